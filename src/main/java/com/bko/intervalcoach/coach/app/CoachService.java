package com.bko.intervalcoach.coach.app;

import com.bko.intervalcoach.coach.DailyCoachUseCase;
import com.bko.intervalcoach.coach.ProjectionUseCase;
import com.bko.intervalcoach.curve.AthleteProfile;
import com.bko.intervalcoach.curve.CurveAnalyzer;
import com.bko.intervalcoach.fitness.FitnessModel;
import com.bko.intervalcoach.fitness.FitnessState;
import com.bko.intervalcoach.fitness.LoadAdvisor;
import com.bko.intervalcoach.fitness.LoadSample;
import com.bko.intervalcoach.fitness.ProjectedDay;
import com.bko.intervalcoach.fitness.WeeklyLoadAdvice;
import com.bko.intervalcoach.phase.GoalTarget;
import com.bko.intervalcoach.phase.PhaseSelector;
import com.bko.intervalcoach.phase.PhaseSignals;
import com.bko.intervalcoach.phase.PhaseState;
import com.bko.intervalcoach.shared.CoachSettings;
import com.bko.intervalcoach.workout.EventPriority;
import com.bko.intervalcoach.workout.EventProximity;
import com.bko.intervalcoach.workout.GoalEvent;
import com.bko.intervalcoach.workout.Recommendation;
import com.bko.intervalcoach.workout.RecoveryAssessor;
import com.bko.intervalcoach.workout.RecoveryTier;
import com.bko.intervalcoach.workout.SelectionContext;
import com.bko.intervalcoach.workout.WorkoutSelectionEngine;
import com.bko.intervalcoach.zones.ProgressionCategory;
import com.bko.intervalcoach.zones.ProgressionHistory;
import com.bko.intervalcoach.zones.SessionZoneTimes;
import com.bko.intervalcoach.zones.Stimulus;
import com.bko.intervalcoach.zones.ZoneExposure;
import com.bko.intervalcoach.zones.ZoneExposureClassifier;
import com.bko.intervalcoach.zones.ZoneProgression;
import com.bko.intervalcoach.zones.ZoneProgressionScorer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

import static java.time.temporal.ChronoUnit.DAYS;

@Service
public class CoachService implements DailyCoachUseCase, ProjectionUseCase {
    private static final Logger logger = LoggerFactory.getLogger(CoachService.class);
    static final int PREVIEW_DAYS = 14;
    static final int MAX_PROJECTION_DAYS = 365;
    private static final int SIGNAL_LOOKBACK_DAYS = 28;

    private final AthleteDataLoader dataLoader;
    private final FitnessModel fitnessModel;
    private final LoadAdvisor loadAdvisor;
    private final ZoneExposureClassifier classifier;
    private final ZoneProgressionScorer progressionScorer;
    private final ProgressionHistory progressionHistory;
    private final PhaseSelector phaseSelector;
    private final CurveAnalyzer curveAnalyzer;
    private final RecoveryAssessor recoveryAssessor;
    private final WorkoutSelectionEngine selectionEngine;
    private final CoachSettings settings;
    private final Clock clock;

    public CoachService(AthleteDataLoader dataLoader,
                        FitnessModel fitnessModel,
                        LoadAdvisor loadAdvisor,
                        ZoneExposureClassifier classifier,
                        ZoneProgressionScorer progressionScorer,
                        ProgressionHistory progressionHistory,
                        PhaseSelector phaseSelector,
                        CurveAnalyzer curveAnalyzer,
                        RecoveryAssessor recoveryAssessor,
                        WorkoutSelectionEngine selectionEngine,
                        CoachSettings settings,
                        Clock clock) {
        this.dataLoader = dataLoader;
        this.fitnessModel = fitnessModel;
        this.loadAdvisor = loadAdvisor;
        this.classifier = classifier;
        this.progressionScorer = progressionScorer;
        this.progressionHistory = progressionHistory;
        this.phaseSelector = phaseSelector;
        this.curveAnalyzer = curveAnalyzer;
        this.recoveryAssessor = recoveryAssessor;
        this.selectionEngine = selectionEngine;
        this.settings = settings;
        this.clock = clock;
    }

    @Override
    public CoachReport runDaily() {
        LocalDate today = LocalDate.now(clock);
        RunDiagnostics diagnostics = new RunDiagnostics();
        logger.info("Starting coaching run for {}", today);

        AthleteData data = dataLoader.load(today, diagnostics);
        FitnessState fitness = fitnessModel.currentState(data.loads(), today);
        AthleteProfile athlete = curveAnalyzer.analyze(data.readings(), data.powerCurve());

        List<ZoneExposure> exposures = classify(data.sessions());
        Map<ProgressionCategory, ZoneProgression> progressions = progressionScorer.score(
                exposures, settings.progression().windowDays(), today, progressionHistory.priorLevels(today));
        progressionHistory.record(today, progressions);

        GoalTarget target = goalTarget(data.events(), today);
        PhaseState phase = phaseSelector.select(today, target, signals(data.loads(), fitness, today));
        RecoveryTier recovery = recoveryAssessor.assess(data.wellness());
        WeeklyLoadAdvice loadAdvice = loadAdvisor.advise(fitness, phase);

        SelectionContext context = selectionContext(today, fitness, recovery, phase, exposures, data.events());
        Recommendation recommendation = selectionEngine.recommend(context);
        ImpactPreview impact = preview(data.loads(), today, recommendation);

        diagnostics.info(String.format(Locale.ROOT, "Phase %s, form %.1f, recovery %s.", phase.name(), fitness.form(), recovery));
        logger.info("Coaching run complete: {} (intensity {}, {})",
                recommendation.typeId(), recommendation.intensity(), recommendation.source());
        return new CoachReport(today, fitness, athlete, progressions, phase, recovery, loadAdvice,
                recommendation, impact, diagnostics.getMessages());
    }

    @Override
    public List<ProjectedDay> project(int days, Map<LocalDate, Double> plannedLoads) {
        if (days < 0 || days > MAX_PROJECTION_DAYS) {
            throw new IllegalArgumentException("Projection days must be within 0.." + MAX_PROJECTION_DAYS + ": " + days);
        }
        LocalDate today = LocalDate.now(clock);
        AthleteData data = dataLoader.load(today, new RunDiagnostics());
        FitnessState seed = fitnessModel.currentState(data.loads(), today);
        return fitnessModel.project(seed, plannedLoads, days);
    }

    /**
     * Both projections start from the end of yesterday so today's planned session lands on day one.
     * Load already completed today is kept in both.
     */
    ImpactPreview preview(List<LoadSample> loads, LocalDate today, Recommendation recommendation) {
        FitnessState seed = fitnessModel.currentState(loads, today.minusDays(1));
        double completedToday = loads.stream()
                .filter(sample -> sample.date().equals(today))
                .mapToDouble(LoadSample::load)
                .sum();
        double estimated = SessionLoadEstimator.estimate(recommendation);

        Map<LocalDate, Double> withSession = new HashMap<>();
        withSession.put(today, completedToday + estimated);
        Map<LocalDate, Double> withoutSession = new HashMap<>();
        withoutSession.put(today, completedToday);

        return ImpactPreview.of(
                Math.round(estimated * 10.0) / 10.0,
                fitnessModel.project(seed, withSession, PREVIEW_DAYS),
                fitnessModel.project(seed, withoutSession, PREVIEW_DAYS));
    }

    private List<ZoneExposure> classify(List<SessionZoneTimes> sessions) {
        List<ZoneExposure> exposures = new ArrayList<>();
        for (SessionZoneTimes session : sessions) {
            classifier.classify(session).ifPresent(exposures::add);
        }
        exposures.sort(Comparator.comparing(ZoneExposure::date));
        return exposures;
    }

    /**
     * Nearest upcoming A event, or the nearest B event when no A event is planned.
     */
    static GoalTarget goalTarget(List<GoalEvent> events, LocalDate today) {
        for (EventPriority priority : List.of(EventPriority.A, EventPriority.B)) {
            GoalEvent next = events.stream()
                    .filter(event -> event.priority() == priority && !event.date().isBefore(today))
                    .min(Comparator.comparing(GoalEvent::date))
                    .orElse(null);
            if (next != null) {
                return new GoalTarget(next.date(), next.name(), next.description());
            }
        }
        return null;
    }

    private PhaseSignals signals(List<LoadSample> loads, FitnessState fitness, LocalDate today) {
        FitnessState earlier = fitnessModel.currentState(loads, today.minusDays(SIGNAL_LOOKBACK_DAYS));
        return new PhaseSignals(fitness.form(), fitness.longAverage(), fitness.longAverage() - earlier.longAverage());
    }

    private SelectionContext selectionContext(LocalDate today,
                                              FitnessState fitness,
                                              RecoveryTier recovery,
                                              PhaseState phase,
                                              List<ZoneExposure> exposures,
                                              List<GoalEvent> events) {
        ZoneExposure last = null;
        Map<Stimulus, Integer> recentCounts = new EnumMap<>(Stimulus.class);
        LocalDate varietyStart = today.minusDays(settings.selection().varietyWindowDays());
        for (ZoneExposure exposure : exposures) {
            if (exposure.date().isAfter(today)) {
                continue;
            }
            last = exposure;
            if (exposure.date().isAfter(varietyStart)) {
                recentCounts.merge(exposure.stimulus(), 1, Integer::sum);
            }
        }
        Integer daysSince = last != null ? (int) DAYS.between(last.date(), today) : null;
        Integer lastIntensity = last != null ? last.stimulus().typicalIntensity() : null;
        return new SelectionContext(today, fitness.form(), recovery, daysSince, lastIntensity, recentCounts,
                phase.phase(), EventProximity.around(today, events),
                settings.selection().minDurationMinutes(), settings.selection().maxDurationMinutes());
    }
}
