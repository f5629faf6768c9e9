package com.bko.intervalcoach.workout;

import java.util.Locale;
import java.util.Optional;

/**
 * Goal event priority: A races are the season targets, C races are training races.
 */
public enum EventPriority {
    A, B, C;

    /**
     * Accepts "A", "b" or provider categories such as "RACE_A".
     */
    public static Optional<EventPriority> parse(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        String normalized = value.trim().toUpperCase(Locale.ROOT);
        if (normalized.startsWith("RACE_")) {
            normalized = normalized.substring("RACE_".length());
        }
        try {
            return Optional.of(valueOf(normalized));
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }
}
