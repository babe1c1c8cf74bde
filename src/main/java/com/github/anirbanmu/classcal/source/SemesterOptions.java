package com.github.anirbanmu.classcal.source;

import com.github.anirbanmu.classcal.log.Log;
import java.util.List;

/**
 * Semesters (and years, for sources that need one) a portal currently offers.
 */
public record SemesterOptions(List<String> semesters, List<String> years) {

    public SemesterOptions {
        semesters = List.copyOf(semesters);
        years = List.copyOf(years);
    }

    public boolean needsYear() {
        return !years.isEmpty();
    }

    public void validate(SemesterSelection selection) {
        boolean badSemester = !semesters.contains(selection.semester());
        boolean badYear = needsYear() && !years.contains(selection.year());
        if (badSemester || badYear) {
            throw new InvalidSelectionException("The values are invalid. It must be one of " + describe());
        }
    }

    // blank parts default to the first offered value
    public SemesterSelection resolve(SemesterSelection selection) {
        String semester = selection == null ? null : selection.semester();
        String year = selection == null ? null : selection.year();

        if (semester == null || semester.isBlank()) {
            if (semesters.isEmpty()) {
                throw new InvalidSelectionException("The portal offers no semesters.");
            }
            semester = semesters.get(0);
            Log.info("semester.defaulted", "semester", semester);
        }
        if (needsYear() && (year == null || year.isBlank())) {
            year = years.get(0);
            Log.info("year.defaulted", "year", year);
        }
        if (!needsYear()) {
            year = null;
        }

        SemesterSelection resolved = new SemesterSelection(semester, year);
        validate(resolved);
        return resolved;
    }

    public String describe() {
        if (needsYear()) {
            return "{semesters=" + semesters + ", years=" + years + "}";
        }
        return "{semesters=" + semesters + "}";
    }
}
