package com.github.anirbanmu.classcal.source;

import java.io.IOException;
import java.util.List;

// fetches raw schedule rows from an authenticated portal
public interface ScheduleSource {
    SemesterOptions semesters() throws IOException, InterruptedException;

    /**
     * Fetches the raw rows of one semester. An empty list means the portal has no schedule
     * published for it yet.
     *
     * @throws InvalidSelectionException if the semester or year is not offered
     */
    List<RawRecord> fetch(SemesterSelection selection) throws IOException, InterruptedException;
}
