package com.github.anirbanmu.classcal.schedule;

import java.time.LocalDateTime;

// first occurrence start and last occurrence end, wall clock in the configured zone
public record OccurrenceWindow(LocalDateTime fromDate, LocalDateTime toDate) {
}
