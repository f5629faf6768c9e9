package com.bko.intervalcoach.phase;

import java.util.Locale;
import java.util.Optional;

public enum TrainingPhase {
    BASE("Base", "Aerobic foundation: long endurance rides, tempo and sweet-spot volume"),
    BUILD("Build", "Raise threshold and VO2max with structured intervals while holding endurance volume"),
    SPECIALTY("Specialty", "Race-specific efforts at goal intensity, sharpen and consolidate"),
    TAPER("Taper", "Cut volume, keep short intensity touches, arrive fresh"),
    RACE_WEEK("Race Week", "Openers and rest, protect freshness for the event");

    private final String displayName;
    private final String focus;

    TrainingPhase(String displayName, String focus) {
        this.displayName = displayName;
        this.focus = focus;
    }

    public String displayName() {
        return displayName;
    }

    public String focus() {
        return focus;
    }

    public static TrainingPhase forWeeksToTarget(int weeksToTarget) {
        if (weeksToTarget >= 16) {
            return BASE;
        } else if (weeksToTarget >= 8) {
            return BUILD;
        } else if (weeksToTarget >= 3) {
            return SPECIALTY;
        } else if (weeksToTarget >= 1) {
            return TAPER;
        }
        return RACE_WEEK;
    }

    /**
     * Accepts the enum name or the display name, ignoring case, spaces, hyphens and underscores.
     */
    public static Optional<TrainingPhase> parse(String name) {
        if (name == null || name.isBlank()) {
            return Optional.empty();
        }
        String normalized = normalize(name);
        for (TrainingPhase phase : values()) {
            if (normalize(phase.name()).equals(normalized) || normalize(phase.displayName).equals(normalized)) {
                return Optional.of(phase);
            }
        }
        return Optional.empty();
    }

    private static String normalize(String value) {
        return value.trim().toLowerCase(Locale.ROOT).replaceAll("[\\s_-]+", "");
    }
}
