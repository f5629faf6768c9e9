package com.bko.intervalcoach.workout;

import java.time.LocalDate;
import java.util.Objects;

/**
 * One day of recovery telemetry. Every figure except the date is optional.
 *
 * @param readiness subjective recovery score, either on a 1 (great) to 4 (poor) scale or 0-100
 */
public record WellnessReading(
        LocalDate date,
        Double hrv,
        Integer restingHeartRate,
        Double sleepHours,
        Integer sleepScore,
        Integer readiness
) {
    public WellnessReading {
        Objects.requireNonNull(date, "date");
    }
}
