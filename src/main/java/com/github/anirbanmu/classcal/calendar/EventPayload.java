package com.github.anirbanmu.classcal.calendar;

import java.time.ZonedDateTime;

// what a sink needs to create one event, weeklyCount 0 means no recurrence rule
public record EventPayload(String summary, String location, String description, ZonedDateTime start, ZonedDateTime end, int weeklyCount, int colorId, int reminderMinutes) {

    public boolean recurring() {
        return weeklyCount > 0;
    }

    public String recurrenceRule() {
        return recurring() ? "RRULE:FREQ=WEEKLY;COUNT=" + weeklyCount : null;
    }
}
