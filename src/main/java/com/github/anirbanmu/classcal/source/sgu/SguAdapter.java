package com.github.anirbanmu.classcal.source.sgu;

import com.github.anirbanmu.classcal.schedule.Descriptor;
import com.github.anirbanmu.classcal.schedule.OccurrenceWindow;
import com.github.anirbanmu.classcal.schedule.ScheduleLookupException;
import com.github.anirbanmu.classcal.schedule.SourceTables;
import com.github.anirbanmu.classcal.source.RawRecord;
import com.github.anirbanmu.classcal.source.ScheduleAdapter;
import com.github.anirbanmu.classcal.source.SemesterSelection;
import java.time.LocalDate;

/**
 * SGU rows are
 * {@code [code, name, group, credits, "class, ...", _, _, _, weekday, startSlot, lessonCount, room, lecturer, weekPattern]}.
 * The anchor is the configured first day of the selected semester.
 */
public final class SguAdapter implements ScheduleAdapter {
    static final int CODE = 0;
    static final int NAME = 1;
    static final int CREDITS = 3;
    static final int CLASS = 4;
    static final int WEEKDAY = 8;
    static final int START_SLOT = 9;
    static final int LESSON_COUNT = 10;
    static final int ROOM = 11;
    static final int LECTURER = 12;
    static final int WEEK_PATTERN = 13;

    private final SourceTables tables;

    public SguAdapter(SourceTables tables) {
        this.tables = tables;
    }

    @Override
    public SourceTables tables() {
        return tables;
    }

    @Override
    public Descriptor standardize(SemesterSelection selection, RawRecord record) {
        LocalDate semesterStart = tables.semesterStart(selection.semester());
        String weekday = record.cell(WEEKDAY);
        int offset = tables.weekdayOffset(weekday);

        int startPeriod = ScheduleAdapter.parseInt(tables.source(), "start_period", record.cell(START_SLOT));
        int lessonCount = ScheduleAdapter.parseInt(tables.source(), "lesson_count", record.cell(LESSON_COUNT));
        int endPeriod = startPeriod + lessonCount;
        ScheduleAdapter.checkLessonRange(tables, startPeriod, endPeriod);

        String weekPattern = record.cell(WEEK_PATTERN);
        if (weekPattern == null) {
            throw new ScheduleLookupException(tables.source() + ": missing 'week_pattern'");
        }

        OccurrenceWindow window = tables.calculator().compute(
            semesterStart,
            offset,
            tables.slotTime(startPeriod),
            lessonCount,
            weekPattern);

        return new Descriptor(
            record.cell(CODE),
            record.cell(NAME),
            record.cell(CREDITS),
            classSection(record.cell(CLASS)),
            record.cell(ROOM),
            record.cell(LECTURER),
            weekday,
            startPeriod,
            endPeriod,
            weekPattern,
            window.fromDate(),
            window.toDate());
    }

    static String classSection(String value) {
        if (value == null) {
            return null;
        }
        int comma = value.indexOf(", ");
        return comma < 0 ? value : value.substring(0, comma);
    }
}
