package com.bko.intervalcoach.phase;

import java.time.LocalDate;
import java.util.Objects;

/**
 * The event the season is periodized towards.
 */
public record GoalTarget(LocalDate date, String name, String description) {
    public GoalTarget {
        Objects.requireNonNull(date, "date");
    }
}
