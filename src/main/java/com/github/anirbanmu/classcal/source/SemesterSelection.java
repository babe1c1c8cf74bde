package com.github.anirbanmu.classcal.source;

// year is null for sources that key semesters by a single id
public record SemesterSelection(String semester, String year) {

    public static SemesterSelection of(String semester) {
        return new SemesterSelection(semester, null);
    }
}
