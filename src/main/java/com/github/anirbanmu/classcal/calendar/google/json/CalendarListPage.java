package com.github.anirbanmu.classcal.calendar.google.json;

import com.dslplatform.json.CompiledJson;
import com.dslplatform.json.JsonAttribute;
import java.util.List;

// one page of GET /users/me/calendarList
@CompiledJson(onUnknown = CompiledJson.Behavior.IGNORE)
public record CalendarListPage(@JsonAttribute(nullable = true) List<Entry> items, @JsonAttribute(nullable = true) String nextPageToken) {

    @CompiledJson(onUnknown = CompiledJson.Behavior.IGNORE)
    public record Entry(String id, @JsonAttribute(nullable = true) String summary) {
    }
}
