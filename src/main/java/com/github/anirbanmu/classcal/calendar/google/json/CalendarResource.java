package com.github.anirbanmu.classcal.calendar.google.json;

import com.dslplatform.json.CompiledJson;
import com.dslplatform.json.JsonAttribute;

@CompiledJson(onUnknown = CompiledJson.Behavior.IGNORE)
public record CalendarResource(String id, String summary, @JsonAttribute(nullable = true) String timeZone, @JsonAttribute(nullable = true) String description) {

    public CalendarResource withSummary(String newSummary) {
        return new CalendarResource(id, newSummary, timeZone, description);
    }
}
