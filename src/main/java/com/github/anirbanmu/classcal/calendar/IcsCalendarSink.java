package com.github.anirbanmu.classcal.calendar;

import biweekly.Biweekly;
import biweekly.ICalendar;
import biweekly.component.VAlarm;
import biweekly.component.VEvent;
import biweekly.parameter.Related;
import biweekly.property.RawProperty;
import biweekly.property.Trigger;
import biweekly.util.Duration;
import biweekly.util.Frequency;
import biweekly.util.Recurrence;
import com.github.anirbanmu.classcal.log.Log;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.Date;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * Keeps each calendar as an iCalendar file in one directory. The calendar name is stored in
 * {@code X-CLASSCAL-NAME} and mirrored to {@code X-WR-CALNAME} for calendar clients. Event times
 * are written in UTC.
 */
public class IcsCalendarSink implements CalendarSink {
    static final String NAME_PROPERTY = "X-CLASSCAL-NAME";
    static final String DISPLAY_NAME_PROPERTY = "X-WR-CALNAME";
    static final String TIMEZONE_PROPERTY = "X-WR-TIMEZONE";
    static final String COLOR_PROPERTY = "X-CLASSCAL-COLOR";
    private static final String EXTENSION = ".ics";

    private final Path directory;
    private final ZoneId zone;

    public IcsCalendarSink(Path directory, ZoneId zone) {
        this.directory = directory;
        this.zone = zone;
    }

    @Override
    public boolean exists(String name) {
        return find(name).isPresent();
    }

    @Override
    public void createCalendar(String name) {
        if (exists(name)) {
            throw new CalendarSinkException("Calendar '" + name + "' already exists.");
        }
        ICalendar ical = new ICalendar();
        ical.setProductId("-//classcal//EN");
        setName(ical, name);
        ical.setExperimentalProperty(TIMEZONE_PROPERTY, zone.getId());

        try {
            Files.createDirectories(directory);
        } catch (IOException e) {
            throw new CalendarSinkException("Cannot create calendar directory " + directory, e);
        }
        Path path = freshPath(name);
        write(path, ical);
        Log.info("ics.calendar_created", "calendar", name, "path", path);
    }

    @Override
    public void renameCalendar(String name, String newName) {
        Path path = require(name);
        ICalendar ical = read(path);
        setName(ical, newName);
        write(path, ical);
        Log.info("ics.calendar_renamed", "calendar", name, "new_name", newName);
    }

    @Override
    public void deleteCalendar(String name) {
        Path path = require(name);
        try {
            Files.delete(path);
        } catch (IOException e) {
            throw new CalendarSinkException("Cannot delete calendar '" + name + "'", e);
        }
        Log.info("ics.calendar_deleted", "calendar", name, "path", path);
    }

    @Override
    public void insertEvents(String calendarName, List<EventPayload> events) {
        Path path = require(calendarName);
        ICalendar ical = read(path);
        for (EventPayload p : events) {
            ical.addEvent(toEvent(p));
        }
        write(path, ical);
        Log.info("ics.events_inserted", "calendar", calendarName, "count", events.size());
    }

    static VEvent toEvent(EventPayload p) {
        VEvent event = new VEvent();
        event.setSummary(p.summary());
        event.setLocation(p.location());
        event.setDescription(p.description());
        event.setDateStart(Date.from(p.start().toInstant()));
        event.setDateEnd(Date.from(p.end().toInstant()));

        // single-day events (exams) never get a recurrence rule
        if (p.recurring()) {
            event.setRecurrenceRule(new Recurrence.Builder(Frequency.WEEKLY).count(p.weeklyCount()).build());
        }
        event.setExperimentalProperty(COLOR_PROPERTY, String.valueOf(p.colorId()));

        if (p.reminderMinutes() > 0) {
            Duration before = Duration.builder().prior(true).minutes(p.reminderMinutes()).build();
            event.addAlarm(VAlarm.display(new Trigger(before, Related.START), p.summary()));
        }
        return event;
    }

    private static void setName(ICalendar ical, String name) {
        ical.setExperimentalProperty(NAME_PROPERTY, name);
        ical.setExperimentalProperty(DISPLAY_NAME_PROPERTY, name);
    }

    static String calendarName(ICalendar ical) {
        RawProperty name = ical.getExperimentalProperty(NAME_PROPERTY);
        return name == null ? null : name.getValue();
    }

    private Optional<Path> find(String name) {
        if (!Files.isDirectory(directory)) {
            return Optional.empty();
        }
        for (Path path : calendarFiles()) {
            if (name.equals(calendarName(read(path)))) {
                return Optional.of(path);
            }
        }
        return Optional.empty();
    }

    private List<Path> calendarFiles() {
        try (Stream<Path> files = Files.list(directory)) {
            List<Path> out = new ArrayList<>();
            files.filter(p -> p.getFileName().toString().endsWith(EXTENSION)).sorted().forEach(out::add);
            return out;
        } catch (IOException e) {
            throw new CalendarSinkException("Cannot list calendar directory " + directory, e);
        }
    }

    private Path require(String name) {
        return find(name).orElseThrow(() -> new CalendarSinkException(
            "Cannot find '" + name + "'. You might need to create a calendar first."));
    }

    private Path freshPath(String name) {
        String slug = slugify(name);
        Path path = directory.resolve(slug + EXTENSION);
        for (int i = 2; Files.exists(path); i++) {
            path = directory.resolve(slug + "-" + i + EXTENSION);
        }
        return path;
    }

    static String slugify(String name) {
        String slug = name.toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9]+", "-").replaceAll("^-+|-+$", "");
        return slug.isEmpty() ? "calendar" : slug;
    }

    private static ICalendar read(Path path) {
        try {
            ICalendar ical = Biweekly.parse(path.toFile()).first();
            if (ical == null) {
                throw new CalendarSinkException("Calendar file " + path + " holds no calendar.");
            }
            return ical;
        } catch (IOException e) {
            throw new CalendarSinkException("Cannot read calendar file " + path, e);
        }
    }

    private static void write(Path path, ICalendar ical) {
        try {
            Biweekly.write(ical).go(path.toFile());
        } catch (IOException e) {
            throw new CalendarSinkException("Cannot write calendar file " + path, e);
        }
    }
}
