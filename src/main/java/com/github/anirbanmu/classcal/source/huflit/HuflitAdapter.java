package com.github.anirbanmu.classcal.source.huflit;

import com.github.anirbanmu.classcal.schedule.Descriptor;
import com.github.anirbanmu.classcal.schedule.OccurrenceWindow;
import com.github.anirbanmu.classcal.schedule.ScheduleLookupException;
import com.github.anirbanmu.classcal.schedule.SourceTables;
import com.github.anirbanmu.classcal.source.RawRecord;
import com.github.anirbanmu.classcal.source.ScheduleAdapter;
import com.github.anirbanmu.classcal.source.SemesterSelection;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoUnit;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * HUFLIT rows carry an explicit date range instead of a week pattern:
 * {@code [#, code, name, credits, class, weekday, "start - end", room, lecturer, "(dd/MM/yyyy - dd/MM/yyyy)"]}.
 *
 * <p>The semester anchor is the start of the week holding the first date, and the week pattern
 * is one digit per week the range covers. A range that starts and ends on the same day is a
 * single-day event and gets an empty pattern.
 */
public final class HuflitAdapter implements ScheduleAdapter {
    static final int CODE = 1;
    static final int NAME = 2;
    static final int CREDITS = 3;
    static final int CLASS = 4;
    static final int WEEKDAY = 5;
    static final int PERIODS = 6;
    static final int ROOM = 7;
    static final int LECTURER = 8;
    static final int DATE_RANGE = 9;

    private static final Pattern PERIOD_RANGE = Pattern.compile("(\\d+)\\s*-\\s*(\\d+)");
    private static final Pattern DATE_RANGE_PATTERN = Pattern.compile("(\\d{1,2}/\\d{1,2}/\\d{4})\\s*-\\s*(\\d{1,2}/\\d{1,2}/\\d{4})");
    private static final DateTimeFormatter DATE_FMT = DateTimeFormatter.ofPattern("d/M/yyyy");

    private final SourceTables tables;

    public HuflitAdapter(SourceTables tables) {
        this.tables = tables;
    }

    @Override
    public SourceTables tables() {
        return tables;
    }

    @Override
    public Descriptor standardize(SemesterSelection selection, RawRecord record) {
        String weekday = record.cell(WEEKDAY);
        int offset = tables.weekdayOffset(weekday);

        Matcher periods = match(PERIOD_RANGE, record.cell(PERIODS), "periods");
        int startPeriod = ScheduleAdapter.parseInt(tables.source(), "start_period", periods.group(1));
        int endPeriod = ScheduleAdapter.parseInt(tables.source(), "end_period", periods.group(2));
        ScheduleAdapter.checkLessonRange(tables, startPeriod, endPeriod);

        Matcher range = match(DATE_RANGE_PATTERN, record.cell(DATE_RANGE), "date range");
        LocalDate first = parseDate(range.group(1));
        LocalDate last = parseDate(range.group(2));
        if (last.isBefore(first)) {
            throw new ScheduleLookupException(tables.source() + ": date range ends before it starts: " + record.cell(DATE_RANGE));
        }

        String weekPattern = weekPattern(first, last);
        OccurrenceWindow window = tables.calculator().compute(
            first.minusDays(offset),
            offset,
            tables.slotTime(startPeriod),
            endPeriod - startPeriod,
            weekPattern);

        return new Descriptor(
            record.cell(CODE),
            record.cell(NAME),
            record.cell(CREDITS),
            record.cell(CLASS),
            record.cell(ROOM),
            record.cell(LECTURER),
            weekday,
            startPeriod,
            endPeriod,
            weekPattern,
            window.fromDate(),
            window.toDate());
    }

    static String weekPattern(LocalDate first, LocalDate last) {
        if (first.equals(last)) {
            return "";
        }
        long weeks = ChronoUnit.WEEKS.between(first, last) + 1;
        StringBuilder sb = new StringBuilder((int) weeks);
        for (long i = 1; i <= weeks; i++) {
            sb.append((char) ('0' + i % 10));
        }
        return sb.toString();
    }

    private Matcher match(Pattern pattern, String value, String field) {
        if (value == null) {
            throw new ScheduleLookupException(tables.source() + ": missing '" + field + "'");
        }
        Matcher m = pattern.matcher(value);
        if (!m.find()) {
            throw new ScheduleLookupException(tables.source() + ": unreadable " + field + " '" + value + "'");
        }
        return m;
    }

    private LocalDate parseDate(String value) {
        try {
            return LocalDate.parse(value, DATE_FMT);
        } catch (DateTimeParseException e) {
            throw new ScheduleLookupException(tables.source() + ": bad date '" + value + "'", e);
        }
    }
}
