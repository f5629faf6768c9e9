package com.bko.intervalcoach.workout;

import com.bko.intervalcoach.advisory.AdvisorySource;
import com.bko.intervalcoach.zones.Stimulus;

import java.util.List;

/**
 * The single workout prescribed for the day.
 */
public record Recommendation(
        String typeId,
        String name,
        Stimulus stimulus,
        int intensity,
        int intensityCeiling,
        int minDurationMinutes,
        int maxDurationMinutes,
        String justification,
        List<Alternate> alternates,
        AdvisorySource source
) {
    public Recommendation {
        if (intensity > intensityCeiling) {
            throw new IllegalStateException("Intensity " + intensity + " exceeds the ceiling " + intensityCeiling);
        }
        alternates = alternates == null ? List.of() : List.copyOf(alternates);
    }

    public record Alternate(String typeId, int intensity, double score, String rationale) {
    }
}
