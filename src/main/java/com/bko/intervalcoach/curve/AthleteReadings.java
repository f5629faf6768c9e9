package com.bko.intervalcoach.curve;

/**
 * Figures reported directly by the data provider; any of them may be null.
 */
public record AthleteReadings(
        Double weightKg,
        Double manualThreshold,
        Double estimatedThreshold,
        Double seasonBestThreshold,
        Double anaerobicCapacity
) {
    public static AthleteReadings none() {
        return new AthleteReadings(null, null, null, null, null);
    }
}
