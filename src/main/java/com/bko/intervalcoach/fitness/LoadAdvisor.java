package com.bko.intervalcoach.fitness;

import com.bko.intervalcoach.advisory.AdvisoryPort;
import com.bko.intervalcoach.advisory.AdvisoryService;
import com.bko.intervalcoach.advisory.AdvisorySource;
import com.bko.intervalcoach.advisory.OracleResponseReader;
import com.bko.intervalcoach.phase.PhaseState;
import com.bko.intervalcoach.phase.TrainingPhase;
import com.bko.intervalcoach.shared.FitnessSettings;
import com.fasterxml.jackson.databind.JsonNode;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Weekly load target. Holding the long average steady needs a daily load equal to it; raising it by
 * {@code r} per week needs {@code longConstant * r / 7} extra per day.
 */
@Component
public class LoadAdvisor {
    private static final double FATIGUE_FORM_LIMIT = -20.0;
    private static final Map<TrainingPhase, Double> RAMP_BY_PHASE = new EnumMap<>(Map.of(
            TrainingPhase.BASE, 4.0,
            TrainingPhase.BUILD, 5.0,
            TrainingPhase.SPECIALTY, 3.0,
            TrainingPhase.TAPER, -5.0,
            TrainingPhase.RACE_WEEK, -8.0));

    private final FitnessSettings settings;
    private final AdvisoryService advisoryService;

    public LoadAdvisor(FitnessSettings settings, AdvisoryService advisoryService) {
        this.settings = settings;
        this.advisoryService = advisoryService;
    }

    public WeeklyLoadAdvice advise(FitnessState state, PhaseState phase) {
        WeeklyLoadAdvice deterministic = deterministic(state, phase.phase());
        AdvisoryPort.AdvisoryPrompt prompt = new AdvisoryPort.AdvisoryPrompt("weekly-load", buildPrompt(state, phase, deterministic));
        return advisoryService.adviseOrFallback(prompt, response -> fromOracle(response, deterministic), () -> deterministic).value();
    }

    public WeeklyLoadAdvice deterministic(FitnessState state, TrainingPhase phase) {
        double ramp = RAMP_BY_PHASE.get(phase);
        String rationale = phase.displayName() + " phase ramp of " + ramp + " per week";
        if (state.form() < FATIGUE_FORM_LIMIT && ramp > 0) {
            ramp = 0.0;
            rationale = "Form " + format(state.form()) + " is deeply negative; hold fitness instead of ramping";
        }
        double weekly = Math.max(0.0, 7 * state.longAverage() + settings.longTimeConstant() * ramp);
        return new WeeklyLoadAdvice(FitnessModel.round(weekly), ramp, rationale, AdvisorySource.FALLBACK);
    }

    Optional<WeeklyLoadAdvice> fromOracle(JsonNode response, WeeklyLoadAdvice deterministic) {
        Double target = OracleResponseReader.number(response, "weeklyLoad");
        if (target == null || target < 0 || target > 2 * deterministic.targetWeeklyLoad() + 100) {
            return Optional.empty();
        }
        Double ramp = OracleResponseReader.number(response, "rampPerWeek");
        String rationale = OracleResponseReader.text(response, "rationale");
        return Optional.of(new WeeklyLoadAdvice(
                FitnessModel.round(target),
                ramp != null ? ramp : deterministic.rampPerWeek(),
                rationale != null ? rationale : "Weekly load proposed by the oracle",
                AdvisorySource.ORACLE));
    }

    private String buildPrompt(FitnessState state, PhaseState phase, WeeklyLoadAdvice deterministic) {
        return "You are an endurance cycling coach setting next week's training load.\n"
                + "Phase: " + phase.name() + (phase.weeksToTarget() != null ? ", " + phase.weeksToTarget() + " weeks to goal" : "") + "\n"
                + "Fitness (CTL): " + format(state.longAverage()) + "; fatigue (ATL): " + format(state.shortAverage())
                + "; form (TSB): " + format(state.form()) + "\n"
                + "Rule-of-thumb target: " + format(deterministic.targetWeeklyLoad()) + " TSS/week\n"
                + "Reply with JSON only: {\"weeklyLoad\": number, \"rampPerWeek\": number, \"rationale\": string}";
    }

    private static String format(double value) {
        return String.format(Locale.ROOT, "%.1f", value);
    }
}
