package com.bko.intervalcoach.shared;

/**
 * @param windowDays           rolling window scored on every run
 * @param plateauRetentionRuns number of prior scoring runs kept for plateau detection
 * @param plateauRetentionDays prior runs older than this are ignored
 */
public record ProgressionSettings(int windowDays, int plateauRetentionRuns, int plateauRetentionDays) {
    public static final ProgressionSettings DEFAULTS = new ProgressionSettings(42, 1, 14);

    public ProgressionSettings {
        if (windowDays < 1) {
            throw new IllegalArgumentException("Progression window must be at least 1 day");
        }
        if (plateauRetentionRuns < 1 || plateauRetentionDays < 1) {
            throw new IllegalArgumentException("Plateau retention must keep at least one run");
        }
    }
}
