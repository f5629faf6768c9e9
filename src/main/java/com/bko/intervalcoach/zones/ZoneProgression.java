package com.bko.intervalcoach.zones;

import java.time.LocalDate;

/**
 * Progression of one category over the scoring window. {@code lastTrained} is null when the
 * category was not trained inside the window.
 */
public record ZoneProgression(
        ProgressionCategory category,
        double level,
        ProgressionTrend trend,
        LocalDate lastTrained,
        int sessionCount,
        double averageLoad,
        double minutes
) {
    public static final double MIN_LEVEL = 1.0;
    public static final double MAX_LEVEL = 10.0;

    public ZoneProgression {
        level = Math.max(MIN_LEVEL, Math.min(MAX_LEVEL, level));
    }

    public static ZoneProgression untrained(ProgressionCategory category) {
        return new ZoneProgression(category, MIN_LEVEL, ProgressionTrend.STABLE, null, 0, 0.0, 0.0);
    }
}
