package com.github.anirbanmu.classcal.schedule;

import java.time.LocalDateTime;

/**
 * Source-agnostic event ready for calendar submission.
 *
 * <p>{@code repeat} is the weekly occurrence count used for the recurrence rule; zero means
 * a single-day event. {@code endPeriodDate} is the first occurrence's date with the lesson end
 * time, {@code color} is a 1-based id stable per subject name within one batch.
 */
public record FormattedEvent(Descriptor descriptor, int repeat, LocalDateTime startPeriodDate, LocalDateTime endPeriodDate, int color) {

    public String code() {
        return descriptor.code();
    }

    public String name() {
        return descriptor.name();
    }

    public String credits() {
        return descriptor.credits();
    }

    public String classSection() {
        return descriptor.classSection();
    }

    public String room() {
        return descriptor.room();
    }

    public String lecturer() {
        return descriptor.lecturer();
    }

    public LocalDateTime fromDate() {
        return descriptor.fromDate();
    }

    public LocalDateTime toDate() {
        return descriptor.toDate();
    }

    public boolean recurring() {
        return repeat > 0;
    }
}
