package com.bko.intervalcoach.curve;

/**
 * Snapshot of the athlete's physiology for one run. Any figure may be null when the data is missing.
 *
 * @param anaerobicCapacity W' in joules
 * @param maxPower          best output of efforts up to five seconds
 */
public record AthleteProfile(
        Double weightKg,
        Double manualThreshold,
        Double currentThreshold,
        Double seasonBestThreshold,
        Double anaerobicCapacity,
        Double maxPower,
        ThresholdModel thresholdModel
) {
    public static AthleteProfile unknown() {
        return new AthleteProfile(null, null, null, null, null, null, ThresholdModel.NONE);
    }

    public Double thresholdPerKg() {
        if (currentThreshold == null || weightKg == null || weightKg <= 0) {
            return null;
        }
        return Math.round(currentThreshold / weightKg * 100.0) / 100.0;
    }
}
