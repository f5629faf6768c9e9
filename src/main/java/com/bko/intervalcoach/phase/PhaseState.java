package com.bko.intervalcoach.phase;

import com.bko.intervalcoach.advisory.AdvisorySource;

/**
 * Periodization phase for today. {@code weeksToTarget} is null without a goal event;
 * {@code reasoning} and {@code confidence} are only set when the oracle overrode the date-based phase.
 */
public record PhaseState(
        TrainingPhase phase,
        Integer weeksToTarget,
        String focus,
        String reasoning,
        PhaseConfidence confidence,
        AdvisorySource source
) {
    public String name() {
        return phase.displayName();
    }
}
