package com.bko.intervalcoach.shared;

/**
 * Time constants (in days) of the long and short exponentially weighted load averages.
 */
public record FitnessSettings(int longTimeConstant, int shortTimeConstant) {
    public static final FitnessSettings DEFAULTS = new FitnessSettings(42, 7);

    public FitnessSettings {
        if (longTimeConstant < 1 || shortTimeConstant < 1) {
            throw new IllegalArgumentException("Time constants must be at least 1 day");
        }
    }
}
