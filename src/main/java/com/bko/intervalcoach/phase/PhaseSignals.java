package com.bko.intervalcoach.phase;

/**
 * Trajectory signals offered to the oracle when it reviews the date-based phase.
 */
public record PhaseSignals(double form, double longAverage, double longAverageChange28Days) {
    public static final PhaseSignals NONE = new PhaseSignals(0.0, 0.0, 0.0);
}
