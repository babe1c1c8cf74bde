package com.github.anirbanmu.classcal;

import com.github.anirbanmu.classcal.calendar.CalendarSink;
import com.github.anirbanmu.classcal.calendar.IcsCalendarSink;
import com.github.anirbanmu.classcal.calendar.SubmissionBridge;
import com.github.anirbanmu.classcal.calendar.google.GoogleCalendarClient;
import com.github.anirbanmu.classcal.config.ClassCalConfig;
import com.github.anirbanmu.classcal.config.ConfigLoader;
import com.github.anirbanmu.classcal.config.SourceConfig;
import com.github.anirbanmu.classcal.log.Log;
import com.github.anirbanmu.classcal.source.Credentials;
import com.github.anirbanmu.classcal.source.SemesterSelection;
import com.github.anirbanmu.classcal.source.Sources;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

public class Main {
    static final int EXIT_OK = 0;
    static final int EXIT_FAILED = 1;
    static final int EXIT_USAGE = 2;

    static final String USAGE = "usage: classcal <import|update> <source> [--semester ID] [--year YEAR] [--calendar NAME]";

    record Invocation(Importer.Mode mode, String source, String semester, String year, String calendar) {
    }

    public static void main(String[] args) {
        int code = run(args, System.getenv());
        Log.flush();
        System.exit(code);
    }

    static int run(String[] args, Map<String, String> env) {
        Invocation inv;
        try {
            inv = parseArgs(args);
        } catch (IllegalArgumentException e) {
            Log.error("startup.bad_arguments", "message", e.getMessage(), "usage", USAGE);
            return EXIT_USAGE;
        }

        ClassCalConfig config;
        try {
            config = loadConfig();
            Log.info("startup.config_loaded", "sources", config.sources().size(), "sink", config.sink());
        } catch (Exception e) {
            Log.error("startup.config_error", e);
            return EXIT_FAILED;
        }

        SourceConfig sourceConfig = config.source(inv.source()).orElse(null);
        if (sourceConfig == null) {
            Log.error("startup.unknown_source", "source", inv.source(), "known", config.sources().stream().map(SourceConfig::name).toList());
            return EXIT_USAGE;
        }

        String username = env.get("PORTAL_USERNAME");
        String password = env.getOrDefault("PORTAL_PASSWORD", "");
        if (username == null || username.isBlank()) {
            Log.error("startup.missing_username", "message", "PORTAL_USERNAME env var is required");
            return EXIT_USAGE;
        }

        CalendarSink sink;
        try {
            sink = createSink(config, env);
        } catch (IllegalStateException e) {
            Log.error("startup.sink_error", "message", e.getMessage());
            return EXIT_USAGE;
        }

        String calendarName = inv.calendar() != null ? inv.calendar() : config.defaultCalendarName();
        Importer importer = new Importer(new SubmissionBridge(sink, config.timeZone(), config.reminderMinutes()));

        try {
            Importer.Result result = importer.run(
                inv.mode(),
                Sources.create(sourceConfig),
                new Credentials(username, password),
                new SemesterSelection(inv.semester(), inv.year()),
                calendarName);
            Log.info("run.finished", "status", result.status(), "events", result.events(), "calendar", calendarName);
            return switch (result.status()) {
                case IMPORTED, UPDATED, NO_SCHEDULE -> EXIT_OK;
                case CALENDAR_EXISTS, CALENDAR_MISSING -> EXIT_FAILED;
            };
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            Log.error("run.interrupted", e);
            return EXIT_FAILED;
        } catch (Exception e) {
            Log.error("run.failed", e);
            for (Throwable suppressed : e.getSuppressed()) {
                Log.error("run.failed_suppressed", suppressed);
            }
            return EXIT_FAILED;
        }
    }

    static Invocation parseArgs(String[] args) {
        if (args.length < 2) {
            throw new IllegalArgumentException("mode and source are required");
        }
        Importer.Mode mode = Importer.Mode.fromString(args[0]);
        String source = args[1];
        String semester = null;
        String year = null;
        String calendar = null;

        for (int i = 2; i < args.length; i++) {
            String flag = args[i];
            if (i + 1 >= args.length) {
                throw new IllegalArgumentException("missing value for " + flag);
            }
            String value = args[++i];
            switch (flag) {
                case "--semester" -> semester = value;
                case "--year" -> year = value;
                case "--calendar" -> calendar = value;
                default -> throw new IllegalArgumentException("unknown option " + flag);
            }
        }
        if (calendar != null && calendar.isBlank()) {
            throw new IllegalArgumentException("--calendar must not be blank");
        }
        return new Invocation(mode, source, semester, year, calendar);
    }

    private static ClassCalConfig loadConfig() throws Exception {
        String configPathStr = System.getProperty("config", "config.toml");
        Path configPath = Path.of(configPathStr);
        if (!Files.exists(configPath)) {
            Log.info("startup.no_config", "path", configPath.toAbsolutePath().toString());
            return ConfigLoader.defaults();
        }
        return ConfigLoader.load(configPath);
    }

    static CalendarSink createSink(ClassCalConfig config, Map<String, String> env) {
        return switch (config.sink()) {
            case ICS -> new IcsCalendarSink(config.icsDirectory(), config.timeZone());
            case GOOGLE -> {
                String token = env.get("GOOGLE_ACCESS_TOKEN");
                if (token == null || token.isBlank()) {
                    throw new IllegalStateException("GOOGLE_ACCESS_TOKEN env var is required for the google sink");
                }
                yield new GoogleCalendarClient(config.googleBaseUrl(), token, config.timeZone());
            }
        };
    }
}
