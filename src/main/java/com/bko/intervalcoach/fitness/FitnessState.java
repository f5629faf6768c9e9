package com.bko.intervalcoach.fitness;

import java.time.LocalDate;
import java.util.Objects;

/**
 * Long (chronic) and short (acute) load averages at the end of {@code date}.
 */
public record FitnessState(LocalDate date, double longAverage, double shortAverage) {
    public FitnessState {
        Objects.requireNonNull(date, "date");
        if (longAverage < 0 || shortAverage < 0) {
            throw new IllegalArgumentException("Load averages must not be negative");
        }
    }

    public static FitnessState coldStart(LocalDate date) {
        return new FitnessState(date, 0.0, 0.0);
    }

    /**
     * Positive when fresh, strongly negative when fatigued.
     */
    public double form() {
        return longAverage - shortAverage;
    }
}
