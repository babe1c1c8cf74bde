package com.github.anirbanmu.classcal.schedule;

import java.time.LocalDate;
import java.time.LocalTime;
import java.util.Map;
import java.util.TreeSet;

/**
 * Static lookup tables of one schedule source: weekday tokens, lesson slot start times and
 * semester anchor dates. Loaded from configuration, never branched on by source name.
 */
public record SourceTables(String source, Map<String, Integer> weekdays, Map<Integer, LocalTime> slots, Map<String, LocalDate> semesters, int lessonMinutes, SpanRule spanRule) {

    public SourceTables {
        weekdays = Map.copyOf(weekdays);
        slots = Map.copyOf(slots);
        semesters = Map.copyOf(semesters);
    }

    public int weekdayOffset(String token) {
        Integer offset = token == null ? null : weekdays.get(token.strip());
        if (offset == null) {
            throw new ScheduleLookupException(source + ": unknown weekday '" + token + "', expected one of " + new TreeSet<>(weekdays.keySet()));
        }
        return offset;
    }

    public LocalTime slotTime(int slot) {
        LocalTime time = slots.get(slot);
        if (time == null) {
            throw new ScheduleLookupException(source + ": unknown lesson slot " + slot + ", expected one of " + new TreeSet<>(slots.keySet()));
        }
        return time;
    }

    public LocalDate semesterStart(String semester) {
        LocalDate start = semester == null ? null : semesters.get(semester);
        if (start == null) {
            throw new ScheduleLookupException(source + ": no start date for semester '" + semester + "', known semesters " + new TreeSet<>(semesters.keySet()));
        }
        return start;
    }

    public OccurrenceCalculator calculator() {
        return new OccurrenceCalculator(lessonMinutes, spanRule);
    }
}
