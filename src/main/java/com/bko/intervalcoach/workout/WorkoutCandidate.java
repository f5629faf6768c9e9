package com.bko.intervalcoach.workout;

import com.bko.intervalcoach.phase.TrainingPhase;
import com.bko.intervalcoach.zones.Stimulus;

import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;

/**
 * One workout type of the catalog together with the conditions under which it may be prescribed.
 */
public record WorkoutCandidate(
        String typeId,
        String name,
        int intensity,
        int minDurationMinutes,
        int maxDurationMinutes,
        Stimulus stimulus,
        Set<TrainingPhase> phases,
        double minForm,
        double maxForm,
        RecoveryTier minRecovery
) {
    public WorkoutCandidate {
        Objects.requireNonNull(typeId, "typeId");
        Objects.requireNonNull(stimulus, "stimulus");
        if (intensity < 1 || intensity > 5) {
            throw new IllegalArgumentException(typeId + ": intensity must be within 1..5");
        }
        if (minDurationMinutes < 0 || maxDurationMinutes < minDurationMinutes) {
            throw new IllegalArgumentException(typeId + ": invalid duration range");
        }
        if (maxForm < minForm) {
            throw new IllegalArgumentException(typeId + ": invalid form range");
        }
        phases = phases == null || phases.isEmpty()
                ? EnumSet.allOf(TrainingPhase.class)
                : EnumSet.copyOf(phases);
        if (minRecovery == null) {
            minRecovery = RecoveryTier.LOW;
        }
    }

    public boolean appliesIn(TrainingPhase phase) {
        return phases.contains(phase);
    }

    public boolean acceptsForm(double form) {
        return form >= minForm && form <= maxForm;
    }
}
