package com.bko.intervalcoach.phase;

import java.util.Locale;
import java.util.Optional;

public enum PhaseConfidence {
    HIGH, MEDIUM, LOW;

    public static Optional<PhaseConfidence> parse(String value) {
        if (value == null) {
            return Optional.empty();
        }
        try {
            return Optional.of(valueOf(value.trim().toUpperCase(Locale.ROOT)));
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }
}
