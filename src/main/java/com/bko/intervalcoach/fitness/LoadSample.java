package com.bko.intervalcoach.fitness;

import java.time.LocalDate;
import java.util.Objects;

/**
 * Training stress recorded on a single day. Several samples may share a date; they are summed.
 */
public record LoadSample(LocalDate date, double load) {
    public LoadSample {
        Objects.requireNonNull(date, "date");
        if (Double.isNaN(load) || Double.isInfinite(load)) {
            throw new IllegalArgumentException("Load on " + date + " is not a finite number");
        }
        if (load < 0) {
            throw new IllegalArgumentException("Load on " + date + " is negative: " + load);
        }
    }
}
