package com.github.anirbanmu.classcal.schedule;

import static org.junit.jupiter.api.Assertions.*;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import org.junit.jupiter.api.Test;

class OccurrenceCalculatorTest {
    private static final LocalDate SEMESTER_START = LocalDate.of(2023, 9, 4);
    private static final LocalTime SEVEN_AM = LocalTime.of(7, 0);

    private final OccurrenceCalculator calculator = new OccurrenceCalculator();

    @Test
    void tenWeekPatternWithoutSkip() {
        OccurrenceWindow window = calculator.compute(SEMESTER_START, 0, SEVEN_AM, 2, "1234567890");

        assertEquals(LocalDateTime.of(2023, 9, 4, 7, 0), window.fromDate());
        assertEquals(LocalDateTime.of(2023, 11, 13, 8, 40), window.toDate());
    }

    @Test
    void leadingSkipMarkersMoveFirstOccurrence() {
        OccurrenceWindow window = calculator.compute(SEMESTER_START, 0, SEVEN_AM, 1, "--12345");

        assertEquals(LocalDateTime.of(2023, 9, 18, 7, 0), window.fromDate(), "two weeks skipped");
    }

    @Test
    void fullPatternSpanCountsSkipMarkers() {
        OccurrenceWindow window = new OccurrenceCalculator(50, SpanRule.FULL_PATTERN)
            .compute(SEMESTER_START, 0, SEVEN_AM, 1, "--12345");

        // 7 characters -> 7 weeks past the first occurrence
        assertEquals(LocalDateTime.of(2023, 11, 6, 7, 50), window.toDate());
    }

    @Test
    void digitsOnlySpanIgnoresSkipMarkers() {
        OccurrenceWindow window = new OccurrenceCalculator(50, SpanRule.DIGITS_ONLY)
            .compute(SEMESTER_START, 0, SEVEN_AM, 1, "--12345");

        assertEquals(LocalDateTime.of(2023, 9, 18, 7, 0), window.fromDate());
        assertEquals(LocalDateTime.of(2023, 10, 23, 7, 50), window.toDate());
    }

    @Test
    void rulesAgreeWhenPatternHasNoSeparators() {
        OccurrenceWindow full = new OccurrenceCalculator(50, SpanRule.FULL_PATTERN)
            .compute(SEMESTER_START, 1, SEVEN_AM, 3, "123456");
        OccurrenceWindow digits = new OccurrenceCalculator(50, SpanRule.DIGITS_ONLY)
            .compute(SEMESTER_START, 1, SEVEN_AM, 3, "123456");

        assertEquals(full, digits);
    }

    @Test
    void weekdayOffsetAddsDays() {
        OccurrenceWindow window = calculator.compute(SEMESTER_START, 3, LocalTime.of(13, 0), 3, "12");

        assertEquals(LocalDateTime.of(2023, 9, 7, 13, 0), window.fromDate());
        assertEquals(LocalDateTime.of(2023, 9, 21, 15, 30), window.toDate());
    }

    @Test
    void emptyPatternIsSingleDay() {
        OccurrenceWindow window = calculator.compute(SEMESTER_START, 2, SEVEN_AM, 2, "");

        assertEquals(window.fromDate().toLocalDate(), window.toDate().toLocalDate());
        assertEquals(LocalDateTime.of(2023, 9, 6, 8, 40), window.toDate());
    }

    @Test
    void lessonLengthIsConfigurable() {
        OccurrenceWindow window = new OccurrenceCalculator(45, SpanRule.FULL_PATTERN)
            .compute(SEMESTER_START, 0, SEVEN_AM, 2, "");

        assertEquals(LocalDateTime.of(2023, 9, 4, 8, 30), window.toDate());
    }

    @Test
    void rejectsOutOfRangeWeekday() {
        assertThrows(ScheduleLookupException.class, () -> calculator.compute(SEMESTER_START, 7, SEVEN_AM, 2, "1"));
        assertThrows(ScheduleLookupException.class, () -> calculator.compute(SEMESTER_START, -1, SEVEN_AM, 2, "1"));
    }

    @Test
    void rejectsEmptyLesson() {
        assertThrows(ScheduleLookupException.class, () -> calculator.compute(SEMESTER_START, 0, SEVEN_AM, 0, "1"));
    }

    @Test
    void rejectsMissingPattern() {
        assertThrows(ScheduleLookupException.class, () -> calculator.compute(SEMESTER_START, 0, SEVEN_AM, 1, null));
    }

    @Test
    void countsLeadingSkips() {
        assertEquals(0, OccurrenceCalculator.leadingSkipWeeks(""));
        assertEquals(0, OccurrenceCalculator.leadingSkipWeeks("123"));
        assertEquals(2, OccurrenceCalculator.leadingSkipWeeks("--3-5"));
        assertEquals(3, OccurrenceCalculator.leadingSkipWeeks("---"));
    }

    @Test
    void spanRuleFromString() {
        assertEquals(SpanRule.FULL_PATTERN, SpanRule.fromString("full_pattern"));
        assertEquals(SpanRule.DIGITS_ONLY, SpanRule.fromString("Digits-Only"));

        IllegalArgumentException e = assertThrows(IllegalArgumentException.class, () -> SpanRule.fromString("weeks"));
        assertTrue(e.getMessage().contains("weeks"));
    }
}
