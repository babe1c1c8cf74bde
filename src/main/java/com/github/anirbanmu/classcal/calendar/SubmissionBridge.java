package com.github.anirbanmu.classcal.calendar;

import com.github.anirbanmu.classcal.log.Log;
import com.github.anirbanmu.classcal.schedule.FormattedEvent;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;

/**
 * Maps formatted events onto sink payloads in the configured time zone and forwards calendar
 * lifecycle calls. Sink errors propagate unchanged.
 */
public class SubmissionBridge {
    // google calendar only knows event colors 1..11
    public static final int MAX_COLOR_ID = 11;

    private final CalendarSink sink;
    private final ZoneId zone;
    private final int reminderMinutes;

    public SubmissionBridge(CalendarSink sink, ZoneId zone, int reminderMinutes) {
        this.sink = sink;
        this.zone = zone;
        this.reminderMinutes = reminderMinutes;
    }

    public EventPayload toPayload(FormattedEvent e) {
        String summary = (e.code() + " " + e.name()).strip();
        String description = "Class: " + e.classSection() + "\nLecturer: " + e.lecturer();
        return new EventPayload(
            summary,
            e.room(),
            description,
            e.startPeriodDate().atZone(zone),
            e.endPeriodDate().atZone(zone),
            e.recurring() ? e.repeat() : 0,
            colorId(e.color()),
            reminderMinutes);
    }

    public int submit(String calendarName, List<FormattedEvent> events) {
        List<EventPayload> payloads = new ArrayList<>(events.size());
        for (FormattedEvent e : events) {
            payloads.add(toPayload(e));
        }
        sink.insertEvents(calendarName, payloads);
        Log.info("bridge.submitted", "calendar", calendarName, "count", payloads.size());
        return payloads.size();
    }

    public boolean exists(String name) {
        return sink.exists(name);
    }

    public void createCalendar(String name) {
        sink.createCalendar(name);
        Log.info("bridge.calendar_created", "calendar", name);
    }

    public void renameCalendar(String name, String newName) {
        sink.renameCalendar(name, newName);
        Log.info("bridge.calendar_renamed", "calendar", name, "new_name", newName);
    }

    public void deleteCalendar(String name) {
        sink.deleteCalendar(name);
        Log.info("bridge.calendar_deleted", "calendar", name);
    }

    static int colorId(int color) {
        return ((color - 1) % MAX_COLOR_ID) + 1;
    }
}
