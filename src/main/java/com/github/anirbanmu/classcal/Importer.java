package com.github.anirbanmu.classcal;

import com.github.anirbanmu.classcal.calendar.SubmissionBridge;
import com.github.anirbanmu.classcal.log.Log;
import com.github.anirbanmu.classcal.schedule.Descriptor;
import com.github.anirbanmu.classcal.schedule.EventFormatter;
import com.github.anirbanmu.classcal.schedule.FormattedBatch;
import com.github.anirbanmu.classcal.source.Credentials;
import com.github.anirbanmu.classcal.source.PortalSession;
import com.github.anirbanmu.classcal.source.RawRecord;
import com.github.anirbanmu.classcal.source.SemesterSelection;
import com.github.anirbanmu.classcal.source.Source;
import java.io.IOException;
import java.util.List;

/**
 * One import or update run: log in, fetch, normalize, format, then replace the calendar.
 * The portal session is released on every exit path.
 */
public class Importer {
    public enum Mode {
        IMPORT, UPDATE;

        public static Mode fromString(String value) {
            return switch (value.toLowerCase()) {
                case "import" -> IMPORT;
                case "update" -> UPDATE;
                default -> throw new IllegalArgumentException("Unknown mode: '" + value + "'. Valid modes: import, update");
            };
        }
    }

    public enum Status {
        IMPORTED, UPDATED, CALENDAR_EXISTS, CALENDAR_MISSING, NO_SCHEDULE
    }

    public record Result(Status status, int events) {
    }

    private final SubmissionBridge bridge;

    public Importer(SubmissionBridge bridge) {
        this.bridge = bridge;
    }

    public Result run(Mode mode, Source source, Credentials credentials, SemesterSelection selection, String calendarName) throws IOException, InterruptedException {
        boolean exists = bridge.exists(calendarName);
        if (mode == Mode.IMPORT && exists) {
            Log.warn("import.calendar_exists", "calendar", calendarName);
            return new Result(Status.CALENDAR_EXISTS, 0);
        }
        if (mode == Mode.UPDATE && !exists) {
            Log.warn("update.calendar_missing", "calendar", calendarName);
            return new Result(Status.CALENDAR_MISSING, 0);
        }

        Log.info("run.started", "mode", mode, "source", source.name(), "calendar", calendarName);
        try (PortalSession session = source.portal().login(credentials)) {
            SemesterSelection resolved = session.semesters().resolve(selection);
            List<RawRecord> rows = session.fetch(resolved);
            if (rows.isEmpty()) {
                Log.warn("run.no_schedule", "source", source.name(), "semester", resolved.semester());
                return new Result(Status.NO_SCHEDULE, 0);
            }

            List<Descriptor> descriptors = source.adapter().standardize(resolved, rows);
            FormattedBatch batch = EventFormatter.format(descriptors);
            Log.info("run.formatted", "events", batch.events().size(), "subjects", batch.colors().size());

            if (mode == Mode.UPDATE) {
                bridge.deleteCalendar(calendarName);
            }
            bridge.createCalendar(calendarName);
            int submitted = bridge.submit(calendarName, batch.events());
            return new Result(mode == Mode.IMPORT ? Status.IMPORTED : Status.UPDATED, submitted);
        }
    }
}
