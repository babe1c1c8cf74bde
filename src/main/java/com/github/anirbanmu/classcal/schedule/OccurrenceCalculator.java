package com.github.anirbanmu.classcal.schedule;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;

/**
 * Turns a semester anchor, weekday offset, slot start time and week pattern into the
 * first-occurrence start and final-occurrence end of a weekly class.
 *
 * <p>Leading non-digit characters of the week pattern are weeks the class skips before it
 * starts meeting. The span of the pattern is measured from the first occurrence according to
 * the configured {@link SpanRule}; an empty span yields a single-day window.
 */
public final class OccurrenceCalculator {
    public static final int LESSON_DURATION_MINUTES = 50;
    private static final int DAYS_PER_WEEK = 7;

    private final int lessonMinutes;
    private final SpanRule spanRule;

    public OccurrenceCalculator() {
        this(LESSON_DURATION_MINUTES, SpanRule.FULL_PATTERN);
    }

    public OccurrenceCalculator(int lessonMinutes, SpanRule spanRule) {
        if (lessonMinutes <= 0) {
            throw new IllegalArgumentException("lessonMinutes must be positive, got " + lessonMinutes);
        }
        this.lessonMinutes = lessonMinutes;
        this.spanRule = spanRule;
    }

    public int lessonMinutes() {
        return lessonMinutes;
    }

    public SpanRule spanRule() {
        return spanRule;
    }

    public OccurrenceWindow compute(LocalDate semesterStart, int weekdayOffset, LocalTime startSlotTime, int lessonCount, String weekPattern) {
        if (semesterStart == null || startSlotTime == null) {
            throw new ScheduleLookupException("semester start and slot time are required");
        }
        if (weekdayOffset < 0 || weekdayOffset >= DAYS_PER_WEEK) {
            throw new ScheduleLookupException("weekday offset out of range: " + weekdayOffset);
        }
        if (lessonCount <= 0) {
            throw new ScheduleLookupException("lesson count must be positive, got " + lessonCount);
        }
        if (weekPattern == null) {
            throw new ScheduleLookupException("week pattern is missing");
        }

        LocalDateTime anchor = semesterStart.atTime(startSlotTime);
        anchor = anchor.plusDays((long) DAYS_PER_WEEK * leadingSkipWeeks(weekPattern));

        LocalDateTime fromDate = anchor.plusDays(weekdayOffset);
        LocalDateTime toDate = fromDate
            .plusDays((long) DAYS_PER_WEEK * spanRule.spanWeeks(weekPattern))
            .plusMinutes((long) lessonCount * lessonMinutes);

        return new OccurrenceWindow(fromDate, toDate);
    }

    static int leadingSkipWeeks(String weekPattern) {
        int skipped = 0;
        for (int i = 0; i < weekPattern.length(); i++) {
            if (Character.isDigit(weekPattern.charAt(i))) {
                break;
            }
            skipped++;
        }
        return skipped;
    }
}
