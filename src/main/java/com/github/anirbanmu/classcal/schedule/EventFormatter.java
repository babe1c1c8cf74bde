package com.github.anirbanmu.classcal.schedule;

import com.github.anirbanmu.classcal.log.Log;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Validates a batch of descriptors and turns it into calendar-ready events.
 *
 * <p>The whole batch is validated before anything is produced, so one bad descriptor fails the
 * batch. Colors are assigned per distinct subject name in first-seen order, starting at 1, and
 * only live for the duration of one {@link #format} call.
 */
public final class EventFormatter {
    private static final long SECONDS_PER_DAY = 86_400;
    private static final int DAYS_PER_WEEK = 7;

    private EventFormatter() {
    }

    public static FormattedBatch format(List<Descriptor> descriptors) {
        List<Descriptor> validated = new ArrayList<>(descriptors.size());
        for (Descriptor d : descriptors) {
            validated.add(validate(d));
        }

        Map<String, Integer> colors = new LinkedHashMap<>();
        List<FormattedEvent> events = new ArrayList<>(validated.size());
        for (Descriptor d : validated) {
            int color = colors.computeIfAbsent(d.name(), k -> colors.size() + 1);
            events.add(new FormattedEvent(d, repeat(d), d.fromDate(), endPeriodDate(d.fromDate(), d.toDate()), color));
        }

        return new FormattedBatch(List.copyOf(events), Collections.unmodifiableMap(colors));
    }

    static Descriptor validate(Descriptor d) {
        if (isBlank(d.name())) {
            throw new ScheduleLookupException("Missing 'name' field.");
        }
        if (isBlank(d.room())) {
            throw new ScheduleLookupException("Missing 'room' field of '" + d.name() + "'.");
        }
        if (d.fromDate() == null || d.toDate() == null) {
            throw new ScheduleLookupException("Missing occurrence dates of '" + d.name() + "'.");
        }

        Descriptor out = d;
        if (d.code() == null) {
            warnMissing("code", d.name());
            out = out.withCode("");
        }
        if (d.classSection() == null) {
            warnMissing("class_section", d.name());
            out = out.withClassSection("");
        }
        if (d.lecturer() == null) {
            warnMissing("lecturer", d.name());
            out = out.withLecturer("");
        }
        return out;
    }

    // whole weeks between first start and last end, floored like the day count itself
    static int repeat(Descriptor d) {
        long seconds = Duration.between(d.fromDate(), d.toDate()).getSeconds();
        long days = Math.floorDiv(seconds, SECONDS_PER_DAY);
        long weeks = Math.floorDiv(days, DAYS_PER_WEEK);
        if (weeks < 0) {
            throw new ScheduleLookupException("Negative repeat for '" + d.name() + "': " + d.fromDate() + " is after " + d.toDate());
        }
        return Math.toIntExact(weeks);
    }

    static LocalDateTime endPeriodDate(LocalDateTime fromDate, LocalDateTime toDate) {
        return fromDate.toLocalDate().atTime(toDate.toLocalTime());
    }

    private static void warnMissing(String field, String name) {
        Log.warn("formatter.missing_field", "field", field, "subject", name);
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
