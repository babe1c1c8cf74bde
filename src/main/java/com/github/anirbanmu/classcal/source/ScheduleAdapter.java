package com.github.anirbanmu.classcal.source;

import com.github.anirbanmu.classcal.schedule.Descriptor;
import com.github.anirbanmu.classcal.schedule.ScheduleLookupException;
import com.github.anirbanmu.classcal.schedule.SourceTables;
import java.util.ArrayList;
import java.util.List;

/**
 * Knows one source's raw row layout and turns rows into descriptors with their occurrence
 * window already computed. Any lookup miss fails the whole batch.
 */
public interface ScheduleAdapter {
    SourceTables tables();

    Descriptor standardize(SemesterSelection selection, RawRecord record);

    default List<Descriptor> standardize(SemesterSelection selection, List<RawRecord> records) {
        List<Descriptor> out = new ArrayList<>(records.size());
        for (int i = 0; i < records.size(); i++) {
            try {
                out.add(standardize(selection, records.get(i)));
            } catch (ScheduleLookupException e) {
                throw new ScheduleLookupException("row " + (i + 1) + ": " + e.getMessage(), e);
            }
        }
        return out;
    }

    static int parseInt(String source, String field, String value) {
        if (value == null) {
            throw new ScheduleLookupException(source + ": missing '" + field + "'");
        }
        try {
            return Integer.parseInt(value.strip());
        } catch (NumberFormatException e) {
            throw new ScheduleLookupException(source + ": '" + field + "' is not a number: '" + value + "'", e);
        }
    }

    // checks end > start and that every slot the class occupies is in the slot table
    static void checkLessonRange(SourceTables tables, int startPeriod, int endPeriod) {
        if (endPeriod <= startPeriod) {
            throw new ScheduleLookupException(tables.source() + ": end period " + endPeriod + " is not after start period " + startPeriod);
        }
        tables.slotTime(startPeriod);
        tables.slotTime(endPeriod - 1);
    }
}
