package com.github.anirbanmu.classcal.calendar;

import java.util.List;

/**
 * A remote or local calendar store addressed by calendar name. Every method either succeeds or
 * throws {@link CalendarSinkException}; nothing is retried.
 */
public interface CalendarSink {
    // exact name match
    boolean exists(String name);

    void createCalendar(String name);

    void renameCalendar(String name, String newName);

    void deleteCalendar(String name);

    void insertEvents(String calendarName, List<EventPayload> events);
}
