package com.github.anirbanmu.classcal.schedule;

import java.util.List;
import java.util.Map;

// output of one EventFormatter call, colors is subject name -> color id in first-seen order
public record FormattedBatch(List<FormattedEvent> events, Map<String, Integer> colors) {
}
