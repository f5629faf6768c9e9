package com.bko.intervalcoach.workout;

import com.bko.intervalcoach.advisory.AdvisoryPort;
import com.bko.intervalcoach.advisory.AdvisoryService;
import com.bko.intervalcoach.advisory.AdvisorySource;
import com.bko.intervalcoach.advisory.OracleResponseReader;
import com.bko.intervalcoach.shared.SelectionSettings;
import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * Picks the day's workout. The oracle is consulted first and its ranked candidates are checked
 * against the catalog and the intensity ceiling; when it has nothing usable, a deterministic
 * rule-based selection over the catalog decides instead.
 */
@Component
public class WorkoutSelectionEngine {
    private static final Logger logger = LoggerFactory.getLogger(WorkoutSelectionEngine.class);
    private static final int EASY_INTENSITY = 2;
    private static final int PREFERRED_INTENSITY = 3;

    private static final List<CeilingRule> CEILING_RULES = List.of(
            new CeilingRule("A/B event tomorrow", ctx -> isMajor(ctx.proximity().tomorrow()), 2),
            new CeilingRule("C event tomorrow", ctx -> ctx.proximity().tomorrow() == EventPriority.C, 3),
            new CeilingRule("A/B event yesterday", ctx -> isMajor(ctx.proximity().yesterday()), 2),
            new CeilingRule("C event yesterday", ctx -> ctx.proximity().yesterday() == EventPriority.C, 3),
            new CeilingRule("form below -20", ctx -> ctx.form() < -20, 2),
            new CeilingRule("form below -10", ctx -> ctx.form() < -10, 3),
            new CeilingRule("hard last session", ctx -> ctx.lastSessionIntensity() != null && ctx.lastSessionIntensity() >= 4, 3),
            new CeilingRule("recovery below moderate", ctx -> !ctx.recovery().isAtLeast(RecoveryTier.MODERATE), 3)
    );

    private static final List<CandidateRule> CANDIDATE_RULES = List.of(
            new CandidateRule("intensity above ceiling", (w, ctx, ceiling) -> w.intensity() <= ceiling),
            new CandidateRule("not used in phase", (w, ctx, ceiling) -> w.appliesIn(ctx.phase())),
            new CandidateRule("form outside precondition", (w, ctx, ceiling) -> w.acceptsForm(ctx.form())),
            new CandidateRule("recovery too low", (w, ctx, ceiling) -> ctx.recovery().isAtLeast(w.minRecovery()))
    );

    private final WorkoutCatalog catalog;
    private final SelectionSettings settings;
    private final AdvisoryService advisoryService;

    public WorkoutSelectionEngine(WorkoutCatalog catalog, SelectionSettings settings, AdvisoryService advisoryService) {
        this.catalog = catalog;
        this.settings = settings;
        this.advisoryService = advisoryService;
    }

    public Recommendation recommend(SelectionContext context) {
        IntensityCeiling ceiling = intensityCeiling(context);
        AdvisoryPort.AdvisoryPrompt prompt = new AdvisoryPort.AdvisoryPrompt("workout", buildPrompt(context, ceiling));
        Recommendation recommendation = advisoryService.adviseOrFallback(
                prompt,
                response -> fromOracle(response, context, ceiling),
                () -> fallback(context, ceiling)).value();
        logger.info("Recommended {} at intensity {} (ceiling {}, source {})",
                recommendation.typeId(), recommendation.intensity(), recommendation.intensityCeiling(), recommendation.source());
        return recommendation;
    }

    /**
     * Minimum over the active constraints; the configured default when none is active.
     */
    public IntensityCeiling intensityCeiling(SelectionContext context) {
        int value = 5;
        List<String> active = new ArrayList<>();
        for (CeilingRule rule : CEILING_RULES) {
            if (rule.condition().test(context)) {
                active.add(rule.name() + " (<=" + rule.cap() + ")");
                value = Math.min(value, rule.cap());
            }
        }
        if (active.isEmpty()) {
            return new IntensityCeiling(settings.defaultCeiling(), List.of());
        }
        return new IntensityCeiling(value, List.copyOf(active));
    }

    public Recommendation fallback(SelectionContext context) {
        return fallback(context, intensityCeiling(context));
    }

    Recommendation fallback(SelectionContext context, IntensityCeiling ceiling) {
        List<WorkoutCandidate> eligible = new ArrayList<>();
        for (WorkoutCandidate workout : catalog.all()) {
            Optional<String> rejection = firstRejection(workout, context, ceiling.value());
            if (rejection.isPresent()) {
                logger.debug("Skipping {}: {}", workout.typeId(), rejection.get());
            } else {
                eligible.add(workout);
            }
        }

        WorkoutCandidate easy = catalog.easyInjection();
        boolean hasEasy = eligible.stream().anyMatch(w -> w.intensity() <= EASY_INTENSITY);
        if (!hasEasy && easy.intensity() <= ceiling.value()) {
            eligible.add(easy);
        }

        if (eligible.isEmpty()) {
            WorkoutCandidate fallbackDefault = catalog.easyDefault();
            logger.info("No catalog entry fits today, using {}", fallbackDefault.typeId());
            return toRecommendation(fallbackDefault, fallbackDefault.intensity(), context, ceiling,
                    "No catalog entry satisfied today's constraints; defaulting to " + fallbackDefault.name()
                            + ". " + describe(ceiling),
                    List.of(), AdvisorySource.FALLBACK);
        }

        eligible.sort(varietyOrder(context));
        WorkoutCandidate selected = eligible.get(0);
        List<Recommendation.Alternate> alternates = eligible.stream()
                .skip(1)
                .limit(settings.maxAlternates())
                .map(w -> new Recommendation.Alternate(w.typeId(), w.intensity(), 0.0,
                        w.stimulus().id() + " used " + context.countFor(w.stimulus()) + "x in 14 days"))
                .toList();
        String justification = "Rule-based selection in " + context.phase().displayName()
                + " with form " + String.format(Locale.ROOT, "%.1f", context.form())
                + " and " + context.recovery() + " recovery. " + describe(ceiling)
                + " " + selected.name() + " trains " + selected.stimulus().id()
                + ", used " + context.countFor(selected.stimulus()) + "x in the last 14 days.";
        return toRecommendation(selected, selected.intensity(), context, ceiling, justification, alternates,
                AdvisorySource.FALLBACK);
    }

    Optional<Recommendation> fromOracle(JsonNode response, SelectionContext context, IntensityCeiling ceiling) {
        List<RankedCandidate> candidates = validateCandidates(response, context, ceiling.value());
        if (candidates.isEmpty()) {
            return Optional.empty();
        }
        RankedCandidate top = candidates.get(0);
        List<Recommendation.Alternate> alternates = candidates.stream()
                .skip(1)
                .limit(settings.maxAlternates())
                .map(c -> new Recommendation.Alternate(c.workout().typeId(), c.intensity(), c.score(), c.rationale()))
                .toList();
        String justification = top.rationale() != null ? top.rationale() : "Ranked first by the oracle.";
        return Optional.of(toRecommendation(top.workout(), top.intensity(), context, ceiling,
                justification + " " + describe(ceiling), alternates, AdvisorySource.ORACLE));
    }

    /**
     * Checks each oracle candidate on its own; a malformed or out-of-catalog entry is dropped
     * without affecting the others. A candidate must state its catalog intensity and pass the same
     * catalog rules as the fallback. The result is ordered by descending score.
     */
    List<RankedCandidate> validateCandidates(JsonNode response, SelectionContext context, int ceiling) {
        JsonNode array = response.get("candidates");
        if (array == null || !array.isArray()) {
            return List.of();
        }
        List<RankedCandidate> valid = new ArrayList<>();
        for (JsonNode node : array) {
            if (!node.isObject()) {
                continue;
            }
            String typeId = OracleResponseReader.text(node, "type");
            Optional<WorkoutCandidate> workout = catalog.find(typeId);
            if (workout.isEmpty()) {
                logger.debug("Discarding oracle candidate with unknown type {}", typeId);
                continue;
            }
            Integer intensity = OracleResponseReader.integer(node, "intensity");
            if (intensity == null || intensity != workout.get().intensity()) {
                logger.debug("Discarding oracle candidate {} with intensity {} (catalog {})",
                        typeId, intensity, workout.get().intensity());
                continue;
            }
            Optional<String> rejection = firstRejection(workout.get(), context, ceiling);
            if (rejection.isPresent()) {
                logger.debug("Discarding oracle candidate {}: {}", typeId, rejection.get());
                continue;
            }
            Double score = 0.0;
            if (node.has("score")) {
                score = OracleResponseReader.number(node, "score");
                if (score == null) {
                    logger.debug("Discarding oracle candidate {} with malformed score", typeId);
                    continue;
                }
            }
            valid.add(new RankedCandidate(workout.get(), workout.get().intensity(), score, OracleResponseReader.text(node, "rationale")));
        }
        valid.sort(Comparator.comparingDouble(RankedCandidate::score).reversed());
        return valid;
    }

    private Optional<String> firstRejection(WorkoutCandidate workout, SelectionContext context, int ceiling) {
        for (CandidateRule rule : CANDIDATE_RULES) {
            if (!rule.predicate().test(workout, context, ceiling)) {
                return Optional.of(rule.name());
            }
        }
        return Optional.empty();
    }

    private Comparator<WorkoutCandidate> varietyOrder(SelectionContext context) {
        return Comparator.<WorkoutCandidate>comparingInt(w -> context.countFor(w.stimulus()))
                .thenComparingInt(w -> Math.abs(w.intensity() - PREFERRED_INTENSITY))
                .thenComparingInt(catalog::indexOf);
    }

    private Recommendation toRecommendation(WorkoutCandidate workout,
                                            int intensity,
                                            SelectionContext context,
                                            IntensityCeiling ceiling,
                                            String justification,
                                            List<Recommendation.Alternate> alternates,
                                            AdvisorySource source) {
        int min = Math.max(workout.minDurationMinutes(), context.minDurationMinutes());
        int max = Math.min(workout.maxDurationMinutes(), context.maxDurationMinutes());
        if (min > max) {
            min = workout.minDurationMinutes();
            max = workout.maxDurationMinutes();
        }
        return new Recommendation(workout.typeId(), workout.name(), workout.stimulus(), intensity, ceiling.value(),
                min, max, justification, alternates, source);
    }

    private String buildPrompt(SelectionContext context, IntensityCeiling ceiling) {
        return "You are an endurance cycling coach choosing today's workout.\n"
                + context.toPromptString() + "\n"
                + "Hard intensity ceiling today: " + ceiling.value() + " (1 easiest, 5 hardest). "
                + "Never propose a higher intensity.\n"
                + "Workout catalog (type id: name | intensity | duration | stimulus | phases):\n"
                + catalog.summary() + "\n"
                + "Prefer stimuli the athlete has not trained recently. Use only type ids from the catalog.\n"
                + "Reply with JSON only: {\"candidates\": [{\"type\": string, \"intensity\": integer, "
                + "\"score\": number between 0 and 1, \"rationale\": string}]}, best candidate first.";
    }

    private String describe(IntensityCeiling ceiling) {
        if (ceiling.activeConstraints().isEmpty()) {
            return "Intensity ceiling " + ceiling.value() + " (no constraint active).";
        }
        return "Intensity ceiling " + ceiling.value() + " from "
                + String.join(", ", ceiling.activeConstraints()) + ".";
    }

    private static boolean isMajor(EventPriority priority) {
        return priority == EventPriority.A || priority == EventPriority.B;
    }

    public record IntensityCeiling(int value, List<String> activeConstraints) {
    }

    record RankedCandidate(WorkoutCandidate workout, int intensity, double score, String rationale) {
    }

    private record CeilingRule(String name, Predicate<SelectionContext> condition, int cap) {
    }

    private record CandidateRule(String name, CandidatePredicate predicate) {
    }

    @FunctionalInterface
    private interface CandidatePredicate {
        boolean test(WorkoutCandidate workout, SelectionContext context, int ceiling);
    }
}
