package com.bko.intervalcoach.zones;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Physiological training effect of a session, with the intensity (1-5) such a session usually carries.
 */
public enum Stimulus {
    RECOVERY(1),
    ENDURANCE(2),
    TEMPO(3),
    SWEETSPOT(3),
    THRESHOLD(4),
    VO2MAX(4),
    ANAEROBIC(5);

    private final int typicalIntensity;

    Stimulus(int typicalIntensity) {
        this.typicalIntensity = typicalIntensity;
    }

    public int typicalIntensity() {
        return typicalIntensity;
    }

    @JsonValue
    public String id() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static Stimulus fromId(String id) {
        if (id == null) {
            throw new IllegalArgumentException("Stimulus id is missing");
        }
        return Stimulus.valueOf(id.trim().toUpperCase(Locale.ROOT));
    }
}
