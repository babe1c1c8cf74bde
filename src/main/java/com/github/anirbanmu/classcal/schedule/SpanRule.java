package com.github.anirbanmu.classcal.schedule;

/**
 * How many weeks a week pattern spans when computing the last occurrence.
 */
public enum SpanRule {
    /** Every character counts, leading skip markers included. */
    FULL_PATTERN,
    /** Only digit characters count; skip markers and separators are stripped. */
    DIGITS_ONLY;

    public int spanWeeks(String weekPattern) {
        return switch (this) {
            case FULL_PATTERN -> weekPattern.length();
            case DIGITS_ONLY -> (int) weekPattern.chars().filter(Character::isDigit).count();
        };
    }

    public static SpanRule fromString(String value) {
        return switch (value.toLowerCase()) {
            case "full_pattern", "full-pattern", "full" -> FULL_PATTERN;
            case "digits_only", "digits-only", "digits" -> DIGITS_ONLY;
            default -> throw new IllegalArgumentException(
                "Unknown span rule: '" + value + "'. Valid rules: full_pattern, digits_only");
        };
    }
}
