package com.github.anirbanmu.classcal.config;

public enum SinkType {
    GOOGLE, ICS;

    public static SinkType fromString(String value) {
        return switch (value.toLowerCase()) {
            case "google" -> GOOGLE;
            case "ics" -> ICS;
            default -> throw new IllegalArgumentException(
                "Unknown sink: '" + value + "'. Valid sinks: google, ics");
        };
    }
}
