package com.github.anirbanmu.classcal.calendar.google.json;

import com.dslplatform.json.CompiledJson;

// body of POST /calendars
@CompiledJson
public record NewCalendar(String summary, String timeZone) {
}
