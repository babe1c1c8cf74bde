package com.github.anirbanmu.classcal.config;

import java.nio.file.Path;
import java.time.ZoneId;
import java.util.List;
import java.util.Optional;

public record ClassCalConfig(ZoneId timeZone, String defaultCalendarName, int reminderMinutes, SinkType sink, Path icsDirectory, String googleBaseUrl, List<SourceConfig> sources) {

    public Optional<SourceConfig> source(String name) {
        for (SourceConfig s : sources) {
            if (s.name().equalsIgnoreCase(name)) {
                return Optional.of(s);
            }
        }
        return Optional.empty();
    }
}
