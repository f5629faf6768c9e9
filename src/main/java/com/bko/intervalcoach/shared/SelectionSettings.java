package com.bko.intervalcoach.shared;

public record SelectionSettings(
        int defaultCeiling,
        int minDurationMinutes,
        int maxDurationMinutes,
        int varietyWindowDays,
        int maxAlternates
) {
    public static final SelectionSettings DEFAULTS = new SelectionSettings(3, 60, 90, 14, 3);

    public SelectionSettings {
        if (defaultCeiling < 1 || defaultCeiling > 5) {
            throw new IllegalArgumentException("Default ceiling must be within 1..5");
        }
        if (minDurationMinutes < 0 || maxDurationMinutes < minDurationMinutes) {
            throw new IllegalArgumentException("Invalid target duration window "
                    + minDurationMinutes + ".." + maxDurationMinutes);
        }
        if (varietyWindowDays < 1) {
            throw new IllegalArgumentException("Variety window must be at least 1 day: " + varietyWindowDays);
        }
        if (maxAlternates < 0) {
            throw new IllegalArgumentException("Max alternates must not be negative: " + maxAlternates);
        }
    }
}
