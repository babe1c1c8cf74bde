package com.github.anirbanmu.classcal.schedule;

import java.time.LocalDateTime;

/**
 * One class meeting series normalized out of a source's raw record. {@code name} and
 * {@code room} are mandatory; {@code code}, {@code classSection} and {@code lecturer} may be null.
 */
public record Descriptor(
    String code,
    String name,
    String credits,
    String classSection,
    String room,
    String lecturer,
    String weekday,
    int startPeriod,
    int endPeriod,
    String weekPattern,
    LocalDateTime fromDate,
    LocalDateTime toDate) {

    public Descriptor withCode(String code) {
        return new Descriptor(code, name, credits, classSection, room, lecturer, weekday, startPeriod, endPeriod, weekPattern, fromDate, toDate);
    }

    public Descriptor withClassSection(String classSection) {
        return new Descriptor(code, name, credits, classSection, room, lecturer, weekday, startPeriod, endPeriod, weekPattern, fromDate, toDate);
    }

    public Descriptor withLecturer(String lecturer) {
        return new Descriptor(code, name, credits, classSection, room, lecturer, weekday, startPeriod, endPeriod, weekPattern, fromDate, toDate);
    }
}
