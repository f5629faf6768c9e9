package com.bko.intervalcoach.workout;

/**
 * Readiness to train derived from wellness telemetry, ordered from worst to best.
 */
public enum RecoveryTier {
    LOW, MODERATE, HIGH;

    public boolean isAtLeast(RecoveryTier other) {
        return compareTo(other) >= 0;
    }
}
