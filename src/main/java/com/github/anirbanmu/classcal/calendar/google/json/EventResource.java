package com.github.anirbanmu.classcal.calendar.google.json;

import com.dslplatform.json.CompiledJson;
import com.dslplatform.json.JsonAttribute;
import java.util.List;

// body of POST /calendars/{id}/events, recurrence is empty for single-day events
@CompiledJson(onUnknown = CompiledJson.Behavior.IGNORE)
public record EventResource(String summary, String location, String description, EventTime start, EventTime end, String colorId, Reminders reminders, List<String> recurrence) {

    public static final String REMINDER_POPUP = "popup";

    @CompiledJson(onUnknown = CompiledJson.Behavior.IGNORE)
    public record EventTime(String dateTime, @JsonAttribute(nullable = true) String timeZone) {
    }

    @CompiledJson(onUnknown = CompiledJson.Behavior.IGNORE)
    public record Reminders(boolean useDefault, List<ReminderOverride> overrides) {
    }

    @CompiledJson(onUnknown = CompiledJson.Behavior.IGNORE)
    public record ReminderOverride(String method, int minutes) {
    }
}
