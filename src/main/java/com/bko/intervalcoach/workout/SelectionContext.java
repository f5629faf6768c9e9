package com.bko.intervalcoach.workout;

import com.bko.intervalcoach.phase.TrainingPhase;
import com.bko.intervalcoach.zones.Stimulus;

import java.time.LocalDate;
import java.util.EnumMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.StringJoiner;

/**
 * Everything the selection engine looks at for one decision.
 *
 * @param daysSinceLastSession null when there is no recorded session
 * @param lastSessionIntensity intensity (1-5) of the last session, null when unknown
 * @param recentStimulusCounts sessions per stimulus inside the variety window
 */
public record SelectionContext(
        LocalDate date,
        double form,
        RecoveryTier recovery,
        Integer daysSinceLastSession,
        Integer lastSessionIntensity,
        Map<Stimulus, Integer> recentStimulusCounts,
        TrainingPhase phase,
        EventProximity proximity,
        int minDurationMinutes,
        int maxDurationMinutes
) {
    public SelectionContext {
        Objects.requireNonNull(date, "date");
        Objects.requireNonNull(phase, "phase");
        if (recovery == null) {
            recovery = RecoveryTier.MODERATE;
        }
        if (proximity == null) {
            proximity = EventProximity.NONE;
        }
        EnumMap<Stimulus, Integer> counts = new EnumMap<>(Stimulus.class);
        if (recentStimulusCounts != null) {
            counts.putAll(recentStimulusCounts);
        }
        recentStimulusCounts = Map.copyOf(counts);
    }

    public int countFor(Stimulus stimulus) {
        return recentStimulusCounts.getOrDefault(stimulus, 0);
    }

    /**
     * Compact rendering for the oracle prompt.
     */
    public String toPromptString() {
        StringBuilder sb = new StringBuilder();
        sb.append("Date: ").append(date).append("\n");
        sb.append("Phase: ").append(phase.displayName()).append(" (focus: ").append(phase.focus()).append(")\n");
        sb.append(String.format(Locale.ROOT, "Form (TSB): %.1f%n", form));
        sb.append("Recovery: ").append(recovery).append("\n");
        sb.append("Days since last session: ").append(daysSinceLastSession == null ? "unknown" : daysSinceLastSession)
          .append("; last session intensity: ").append(lastSessionIntensity == null ? "unknown" : lastSessionIntensity)
          .append("\n");
        StringJoiner joiner = new StringJoiner(", ", "{", "}");
        for (Stimulus stimulus : Stimulus.values()) {
            joiner.add(stimulus.id() + ":" + countFor(stimulus));
        }
        sb.append("Sessions per stimulus, last 14 days: ").append(joiner).append("\n");
        sb.append("Event tomorrow: ").append(proximity.tomorrow() == null ? "none" : "priority " + proximity.tomorrow())
          .append("; event yesterday: ").append(proximity.yesterday() == null ? "none" : "priority " + proximity.yesterday())
          .append("\n");
        sb.append("Target duration: ").append(minDurationMinutes).append("-").append(maxDurationMinutes).append(" min");
        return sb.toString();
    }
}
