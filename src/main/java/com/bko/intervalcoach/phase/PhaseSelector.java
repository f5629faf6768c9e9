package com.bko.intervalcoach.phase;

import com.bko.intervalcoach.advisory.AdvisoryPort;
import com.bko.intervalcoach.advisory.AdvisoryService;
import com.bko.intervalcoach.advisory.AdvisorySource;
import com.bko.intervalcoach.advisory.OracleResponseReader;
import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;
import java.util.stream.Collectors;

import static java.time.temporal.ChronoUnit.DAYS;

/**
 * Maps the distance to the goal event onto a periodization phase. The date-based phase is always
 * computed first; the oracle may then replace it when it answers with a known phase name.
 */
@Component
public class PhaseSelector {
    private static final Logger logger = LoggerFactory.getLogger(PhaseSelector.class);
    private static final String NO_TARGET_FOCUS = "General fitness: build aerobic base and keep variety";

    private final AdvisoryService advisoryService;

    public PhaseSelector(AdvisoryService advisoryService) {
        this.advisoryService = advisoryService;
    }

    /**
     * Date arithmetic only. Goals in the past count as no goal.
     */
    public PhaseState byDate(LocalDate today, GoalTarget target) {
        if (target == null || target.date().isBefore(today)) {
            return new PhaseState(TrainingPhase.BASE, null, NO_TARGET_FOCUS, null, null, AdvisorySource.FALLBACK);
        }
        int weeksToTarget = (int) (DAYS.between(today, target.date()) / 7);
        TrainingPhase phase = TrainingPhase.forWeeksToTarget(weeksToTarget);
        return new PhaseState(phase, weeksToTarget, phase.focus(), null, null, AdvisorySource.FALLBACK);
    }

    public PhaseState select(LocalDate today, GoalTarget target, PhaseSignals signals) {
        PhaseState byDate = byDate(today, target);
        AdvisoryPort.AdvisoryPrompt prompt = new AdvisoryPort.AdvisoryPrompt(
                "phase", buildPrompt(today, target, signals == null ? PhaseSignals.NONE : signals, byDate));
        PhaseState selected = advisoryService.adviseOrFallback(prompt, response -> toOverride(response, byDate), () -> byDate).value();
        if (selected.phase() != byDate.phase()) {
            logger.info("Oracle moved phase from {} to {} ({} confidence)",
                    byDate.phase(), selected.phase(), selected.confidence());
        }
        return selected;
    }

    Optional<PhaseState> toOverride(JsonNode response, PhaseState byDate) {
        Optional<TrainingPhase> phase = TrainingPhase.parse(OracleResponseReader.text(response, "phase"));
        if (phase.isEmpty()) {
            return Optional.empty();
        }
        String focus = OracleResponseReader.text(response, "focus");
        String reasoning = OracleResponseReader.text(response, "reasoning");
        PhaseConfidence confidence = PhaseConfidence.parse(OracleResponseReader.text(response, "confidence"))
                .orElse(PhaseConfidence.LOW);
        return Optional.of(new PhaseState(
                phase.get(),
                byDate.weeksToTarget(),
                focus != null ? focus : phase.get().focus(),
                reasoning,
                confidence,
                AdvisorySource.ORACLE));
    }

    private String buildPrompt(LocalDate today, GoalTarget target, PhaseSignals signals, PhaseState byDate) {
        StringBuilder sb = new StringBuilder();
        sb.append("You are an endurance cycling coach reviewing the athlete's periodization phase.\n");
        sb.append("Today: ").append(today).append("\n");
        if (target != null) {
            sb.append("Goal event: ").append(target.name()).append(" on ").append(target.date());
            if (target.description() != null && !target.description().isBlank()) {
                sb.append(" (").append(target.description()).append(")");
            }
            sb.append("\n");
        } else {
            sb.append("Goal event: none scheduled\n");
        }
        sb.append("Date-based phase: ").append(byDate.name());
        if (byDate.weeksToTarget() != null) {
            sb.append(", ").append(byDate.weeksToTarget()).append(" weeks to go");
        }
        sb.append("\n");
        sb.append(String.format(Locale.ROOT, "Fitness (CTL)=%.1f; form (TSB)=%.1f; CTL change over 28 days=%.1f%n",
                signals.longAverage(), signals.form(), signals.longAverageChange28Days()));
        sb.append("Allowed phases: ")
          .append(Arrays.stream(TrainingPhase.values()).map(TrainingPhase::displayName).collect(Collectors.joining(", ")))
          .append("\n");
        sb.append("Reply with JSON only: {\"phase\": string, \"focus\": string, \"reasoning\": string, "
                + "\"confidence\": \"high\"|\"medium\"|\"low\"}");
        return sb.toString();
    }
}
