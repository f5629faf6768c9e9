package com.bko.intervalcoach.coach.app;

import com.bko.intervalcoach.curve.AthleteProfile;
import com.bko.intervalcoach.fitness.FitnessState;
import com.bko.intervalcoach.fitness.WeeklyLoadAdvice;
import com.bko.intervalcoach.phase.PhaseState;
import com.bko.intervalcoach.workout.RecoveryTier;
import com.bko.intervalcoach.workout.Recommendation;
import com.bko.intervalcoach.zones.ProgressionCategory;
import com.bko.intervalcoach.zones.ZoneProgression;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;

public record CoachReport(
        LocalDate date,
        FitnessState fitness,
        AthleteProfile athlete,
        Map<ProgressionCategory, ZoneProgression> progressions,
        PhaseState phase,
        RecoveryTier recovery,
        WeeklyLoadAdvice loadAdvice,
        Recommendation recommendation,
        ImpactPreview impact,
        List<String> messages
) {
    public CoachReport {
        progressions = Map.copyOf(progressions);
        messages = List.copyOf(messages);
    }
}
