package com.github.anirbanmu.classcal.config;

import com.github.anirbanmu.classcal.calendar.google.GoogleCalendarClient;
import com.github.anirbanmu.classcal.schedule.OccurrenceCalculator;
import com.github.anirbanmu.classcal.schedule.SourceTables;
import com.github.anirbanmu.classcal.schedule.SpanRule;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.time.DateTimeException;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.tomlj.Toml;
import org.tomlj.TomlParseResult;
import org.tomlj.TomlTable;

public class ConfigLoader {
    public static final String BUILT_IN_SOURCES = "/classcal-sources.toml";
    static final String DEFAULT_TIME_ZONE = "Asia/Ho_Chi_Minh";
    static final String DEFAULT_CALENDAR_NAME = "Class Schedule";
    static final int DEFAULT_REMINDER_MINUTES = 30;
    static final String DEFAULT_ICS_DIRECTORY = "calendars";

    public static ClassCalConfig load(Path path) throws IOException {
        TomlParseResult result = Toml.parse(path);
        return parse(result, builtInSources());
    }

    public static ClassCalConfig load(InputStream stream) throws IOException {
        TomlParseResult result = Toml.parse(stream);
        return parse(result, builtInSources());
    }

    public static ClassCalConfig load(String content) {
        TomlParseResult result = Toml.parse(content);
        return parse(result, builtInSources());
    }

    // configuration with nothing but the bundled sources
    public static ClassCalConfig defaults() {
        return load("");
    }

    public static List<SourceConfig> builtInSources() {
        try (InputStream in = ConfigLoader.class.getResourceAsStream(BUILT_IN_SOURCES)) {
            if (in == null) {
                throw new ConfigException("Missing bundled resource " + BUILT_IN_SOURCES);
            }
            TomlParseResult result = Toml.parse(in);
            checkErrors(result);
            return parseSources(result);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    private static ClassCalConfig parse(TomlParseResult result, List<SourceConfig> builtIn) {
        checkErrors(result);

        String zoneStr = stringOr(result, "timeZone", DEFAULT_TIME_ZONE);
        ZoneId zone;
        try {
            zone = ZoneId.of(zoneStr);
        } catch (DateTimeException e) {
            throw new ConfigException("Invalid 'timeZone': " + zoneStr);
        }

        String calendarName = stringOr(result, "defaultCalendarName", DEFAULT_CALENDAR_NAME);
        if (calendarName.isBlank()) {
            throw new ConfigException("'defaultCalendarName' must not be blank.");
        }

        Long reminder = result.getLong("reminderMinutes");
        int reminderMinutes = reminder == null ? DEFAULT_REMINDER_MINUTES : Math.toIntExact(reminder);
        if (reminderMinutes < 0) {
            throw new ConfigException("'reminderMinutes' must not be negative, got " + reminderMinutes);
        }

        SinkType sink;
        try {
            sink = SinkType.fromString(stringOr(result, "sink", "google"));
        } catch (IllegalArgumentException e) {
            throw new ConfigException(e.getMessage());
        }

        Path icsDirectory = Path.of(stringOr(result, "ics.directory", DEFAULT_ICS_DIRECTORY));
        String googleBaseUrl = stringOr(result, "google.baseUrl", GoogleCalendarClient.DEFAULT_BASE_URL);

        // user sources replace bundled ones of the same name
        Map<String, SourceConfig> sources = new LinkedHashMap<>();
        for (SourceConfig s : builtIn) {
            sources.put(s.name().toLowerCase(), s);
        }
        for (SourceConfig s : parseSources(result)) {
            sources.put(s.name().toLowerCase(), s);
        }

        return new ClassCalConfig(zone, calendarName, reminderMinutes, sink, icsDirectory, googleBaseUrl,
            List.copyOf(sources.values()));
    }

    private static List<SourceConfig> parseSources(TomlParseResult result) {
        List<SourceConfig> sources = new ArrayList<>();
        if (!result.contains("sources")) {
            return sources;
        }
        if (!result.isArray("sources")) {
            throw new ConfigException("'sources' must be an array of tables.");
        }
        for (Object obj : result.getArray("sources").toList()) {
            if (obj instanceof TomlTable table) {
                sources.add(parseSource(table));
            }
        }
        return sources;
    }

    private static SourceConfig parseSource(TomlTable table) {
        String name = table.getString("name");
        if (name == null || name.isBlank()) {
            throw new ConfigException("Source missing required 'name' field.");
        }

        String kind = table.getString("kind");
        if (kind == null || kind.isBlank()) {
            kind = name;
        }

        String baseUrl = table.getString("baseUrl");
        if (baseUrl == null || baseUrl.isBlank()) {
            throw new ConfigException("Source '" + name + "' missing required 'baseUrl' field.");
        }

        Long lesson = table.getLong("lessonMinutes");
        int lessonMinutes = lesson == null ? OccurrenceCalculator.LESSON_DURATION_MINUTES : Math.toIntExact(lesson);
        if (lessonMinutes <= 0) {
            throw new ConfigException("Source '" + name + "' has invalid 'lessonMinutes': " + lessonMinutes);
        }

        SpanRule spanRule = SpanRule.FULL_PATTERN;
        String spanStr = table.getString("spanRule");
        if (spanStr != null) {
            try {
                spanRule = SpanRule.fromString(spanStr);
            } catch (IllegalArgumentException e) {
                throw new ConfigException("Source '" + name + "': " + e.getMessage());
            }
        }

        Map<String, Integer> weekdays = new HashMap<>();
        for (Map.Entry<String, Object> e : requireTable(table, "weekdays", name).entrySet()) {
            if (!(e.getValue() instanceof Long offset) || offset < 0 || offset > 6) {
                throw new ConfigException("Source '" + name + "' weekday '" + e.getKey() + "' must be an offset 0..6, got " + e.getValue());
            }
            weekdays.put(e.getKey(), offset.intValue());
        }

        Map<Integer, LocalTime> slots = new HashMap<>();
        for (Map.Entry<String, Object> e : requireTable(table, "slots", name).entrySet()) {
            int slot;
            try {
                slot = Integer.parseInt(e.getKey());
            } catch (NumberFormatException ex) {
                throw new ConfigException("Source '" + name + "' slot key must be a number, got '" + e.getKey() + "'");
            }
            slots.put(slot, parseTime(e.getValue(), name, e.getKey()));
        }

        Map<String, LocalDate> semesters = new HashMap<>();
        if (table.isTable("semesters")) {
            for (Map.Entry<String, Object> e : table.getTable("semesters").toMap().entrySet()) {
                semesters.put(e.getKey(), parseDate(e.getValue(), name, e.getKey()));
            }
        }

        SourceTables tables = new SourceTables(name, weekdays, slots, semesters, lessonMinutes, spanRule);
        return new SourceConfig(name, kind.toLowerCase(), baseUrl, tables);
    }

    private static Map<String, Object> requireTable(TomlTable table, String key, String source) {
        if (!table.isTable(key) || table.getTable(key).isEmpty()) {
            throw new ConfigException("Source '" + source + "' missing required '" + key + "' table.");
        }
        return table.getTable(key).toMap();
    }

    private static LocalTime parseTime(Object value, String source, String key) {
        if (value instanceof LocalTime time) {
            return time;
        }
        try {
            return LocalTime.parse(String.valueOf(value));
        } catch (DateTimeException e) {
            throw new ConfigException("Source '" + source + "' slot " + key + " has invalid time: " + value);
        }
    }

    private static LocalDate parseDate(Object value, String source, String key) {
        if (value instanceof LocalDate date) {
            return date;
        }
        try {
            return LocalDate.parse(String.valueOf(value));
        } catch (DateTimeException e) {
            throw new ConfigException("Source '" + source + "' semester " + key + " has invalid date: " + value);
        }
    }

    private static String stringOr(TomlParseResult result, String key, String fallback) {
        String value = result.getString(key);
        return value == null ? fallback : value;
    }

    private static void checkErrors(TomlParseResult result) {
        if (result.hasErrors()) {
            StringBuilder sb = new StringBuilder("Failed to parse TOML configuration:\n");
            result.errors().forEach(error -> sb.append("- ").append(error.toString()).append("\n"));
            throw new ConfigException(sb.toString());
        }
    }
}
