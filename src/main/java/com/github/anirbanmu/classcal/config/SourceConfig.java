package com.github.anirbanmu.classcal.config;

import com.github.anirbanmu.classcal.schedule.SourceTables;

// kind selects the portal/adapter implementation, name is what the user types
public record SourceConfig(String name, String kind, String baseUrl, SourceTables tables) {
}
