package com.bko.intervalcoach.workout;

import com.bko.intervalcoach.advisory.AdvisoryPort;
import com.bko.intervalcoach.advisory.AdvisoryService;
import com.bko.intervalcoach.advisory.AdvisorySource;
import com.bko.intervalcoach.phase.TrainingPhase;
import com.bko.intervalcoach.shared.OracleSettings;
import com.bko.intervalcoach.shared.RetryPolicy;
import com.bko.intervalcoach.shared.SelectionSettings;
import com.bko.intervalcoach.zones.Stimulus;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class WorkoutSelectionEngineTest {
    private static final LocalDate TODAY = LocalDate.of(2025, 4, 14);
    private static final WorkoutCatalog CATALOG = WorkoutCatalog.load(new ObjectMapper());

    @Test
    void buildPhaseWithFreshLegsGetsAModerateSession() {
        WorkoutSelectionEngine engine = fallbackEngine();

        Recommendation recommendation = engine.recommend(context(5.0, RecoveryTier.HIGH, TrainingPhase.BUILD, EventProximity.NONE));

        assertEquals("tempo_blocks", recommendation.typeId());
        assertEquals(3, recommendation.intensity());
        assertEquals(3, recommendation.intensityCeiling());
        assertEquals(AdvisorySource.FALLBACK, recommendation.source());
        assertEquals(60, recommendation.minDurationMinutes());
        assertEquals(90, recommendation.maxDurationMinutes());
        assertFalse(recommendation.alternates().isEmpty());
    }

    @Test
    void deepFatigueCapsIntensityAtTwo() {
        WorkoutSelectionEngine engine = fallbackEngine();
        SelectionContext context = context(-25.0, RecoveryTier.HIGH, TrainingPhase.BUILD, EventProximity.NONE);

        Recommendation recommendation = engine.recommend(context);

        assertEquals(2, engine.intensityCeiling(context).value());
        assertTrue(recommendation.intensity() <= 2);
        assertEquals("endurance_steady", recommendation.typeId());
    }

    @Test
    void majorEventTomorrowCapsIntensityAtTwo() {
        WorkoutSelectionEngine engine = fallbackEngine();
        SelectionContext context = context(5.0, RecoveryTier.HIGH, TrainingPhase.BUILD,
                new EventProximity(EventPriority.A, null));

        Recommendation recommendation = engine.recommend(context);

        assertEquals(2, recommendation.intensityCeiling());
        assertTrue(recommendation.intensity() <= 2);
        assertTrue(recommendation.justification().contains("A/B event tomorrow"));
    }

    @Test
    void ceilingIsTheMinimumOfActiveConstraints() {
        WorkoutSelectionEngine engine = fallbackEngine();

        assertEquals(3, engine.intensityCeiling(context(5.0, RecoveryTier.HIGH, TrainingPhase.BUILD,
                new EventProximity(EventPriority.C, null))).value());
        assertEquals(3, engine.intensityCeiling(context(5.0, RecoveryTier.LOW, TrainingPhase.BUILD,
                EventProximity.NONE)).value());
        assertEquals(3, engine.intensityCeiling(context(-15.0, RecoveryTier.HIGH, TrainingPhase.BUILD,
                EventProximity.NONE)).value());

        WorkoutSelectionEngine.IntensityCeiling combined = engine.intensityCeiling(context(-15.0, RecoveryTier.LOW,
                TrainingPhase.BUILD, new EventProximity(null, EventPriority.B)));
        assertEquals(2, combined.value());
        assertEquals(3, combined.activeConstraints().size());
    }

    @Test
    void hardLastSessionCapsAtThree() {
        WorkoutSelectionEngine engine = fallbackEngine();
        SelectionContext context = new SelectionContext(TODAY, 5.0, RecoveryTier.HIGH, 1, 4, Map.of(),
                TrainingPhase.SPECIALTY, EventProximity.NONE, 60, 90);

        assertEquals(3, engine.intensityCeiling(context).value());
        assertTrue(engine.recommend(context).intensity() <= 3);
    }

    @Test
    void varietyPrefersStimuliNotTrainedRecently() {
        WorkoutSelectionEngine engine = fallbackEngine();
        SelectionContext context = new SelectionContext(TODAY, 5.0, RecoveryTier.HIGH, 1, 3,
                Map.of(Stimulus.TEMPO, 3, Stimulus.ENDURANCE, 1), TrainingPhase.BUILD, EventProximity.NONE, 60, 90);

        assertEquals("sweetspot_intervals", engine.recommend(context).typeId());
    }

    @Test
    void alwaysReturnsARecommendationWithinTheCeiling() {
        WorkoutSelectionEngine engine = fallbackEngine();

        for (TrainingPhase phase : TrainingPhase.values()) {
            for (RecoveryTier recovery : RecoveryTier.values()) {
                for (double form : new double[]{-150.0, -25.0, -12.0, 0.0, 30.0}) {
                    SelectionContext context = context(form, recovery, phase, new EventProximity(EventPriority.B, null));
                    Recommendation recommendation = engine.recommend(context);
                    assertNotNull(recommendation.typeId());
                    assertTrue(recommendation.intensity() <= recommendation.intensityCeiling());
                }
            }
        }
    }

    @Test
    void emptyCandidateSetFallsBackToTheEasyDefault() {
        WorkoutCatalog catalog = new WorkoutCatalog(List.of(
                new WorkoutCandidate("spin", "Spin", 1, 30, 45, Stimulus.RECOVERY, null, 0, 100, null),
                new WorkoutCandidate("steady", "Steady", 2, 60, 90, Stimulus.ENDURANCE, null, -100, 100, null)),
                "spin", "steady");
        WorkoutSelectionEngine engine = new WorkoutSelectionEngine(catalog,
                new SelectionSettings(1, 60, 90, 14, 3), disabledAdvisory());

        Recommendation recommendation = engine.recommend(context(-5.0, RecoveryTier.HIGH, TrainingPhase.BASE, EventProximity.NONE));

        assertEquals("spin", recommendation.typeId());
        assertEquals(1, recommendation.intensity());
        assertTrue(recommendation.alternates().isEmpty());
    }

    @Test
    void keepsTheValidOracleCandidateAndDropsMalformedOnes() {
        WorkoutSelectionEngine engine = oracleEngine("{\"candidates\": ["
                + "{\"type\": \"unknown_type\", \"intensity\": 2, \"score\": 0.9},"
                + "{\"type\": \"gravel_epic\", \"intensity\": 3, \"score\": 0.85},"
                + "{\"type\": \"tempo_blocks\", \"intensity\": \"three\", \"score\": 0.8},"
                + "{\"type\": \"sweetspot_intervals\", \"intensity\": 3, \"score\": 0.7, \"rationale\": \"Sweet spot suits the build\"}"
                + "]}");

        Recommendation recommendation = engine.recommend(context(5.0, RecoveryTier.HIGH, TrainingPhase.BUILD, EventProximity.NONE));

        assertEquals("sweetspot_intervals", recommendation.typeId());
        assertEquals(AdvisorySource.ORACLE, recommendation.source());
        assertTrue(recommendation.justification().startsWith("Sweet spot suits the build"));
        assertTrue(recommendation.alternates().isEmpty());
    }

    @Test
    void oracleCandidatesAreRankedByScore() {
        WorkoutSelectionEngine engine = oracleEngine("{\"candidates\": ["
                + "{\"type\": \"endurance_steady\", \"intensity\": 2, \"score\": 0.4},"
                + "{\"type\": \"tempo_blocks\", \"intensity\": 3, \"score\": 0.9}"
                + "]}");

        Recommendation recommendation = engine.recommend(context(5.0, RecoveryTier.HIGH, TrainingPhase.BUILD, EventProximity.NONE));

        assertEquals("tempo_blocks", recommendation.typeId());
        assertEquals(1, recommendation.alternates().size());
        assertEquals("endurance_steady", recommendation.alternates().get(0).typeId());
    }

    @Test
    void oracleCandidateAboveTheCeilingIsDiscarded() {
        WorkoutSelectionEngine engine = oracleEngine(
                "{\"candidates\": [{\"type\": \"vo2max_intervals\", \"intensity\": 4, \"score\": 1.0}]}");

        Recommendation recommendation = engine.recommend(context(5.0, RecoveryTier.HIGH, TrainingPhase.BUILD,
                new EventProximity(EventPriority.A, null)));

        assertEquals(AdvisorySource.FALLBACK, recommendation.source());
        assertTrue(recommendation.intensity() <= 2);
    }

    @Test
    void keepsTheValidOracleCandidateAmongUnknownTypes() {
        WorkoutSelectionEngine engine = oracleEngine("{\"candidates\": ["
                + "{\"type\": \"zwift_race\", \"intensity\": 4, \"score\": 0.9},"
                + "{\"type\": \"endurance_steady\", \"intensity\": 2, \"score\": 0.5},"
                + "{\"type\": \"track_sprints\", \"intensity\": 5, \"score\": 0.8}"
                + "]}");

        Recommendation recommendation = engine.recommend(context(5.0, RecoveryTier.HIGH, TrainingPhase.BUILD, EventProximity.NONE));

        assertEquals("endurance_steady", recommendation.typeId());
        assertEquals(AdvisorySource.ORACLE, recommendation.source());
        assertTrue(recommendation.alternates().isEmpty());
    }

    @Test
    void oracleCandidateWithUnderstatedIntensityIsDiscarded() {
        WorkoutSelectionEngine engine = oracleEngine(
                "{\"candidates\": [{\"type\": \"anaerobic_sprints\", \"intensity\": 1, \"score\": 1.0}]}");

        Recommendation recommendation = engine.recommend(context(-30.0, RecoveryTier.LOW, TrainingPhase.BASE,
                new EventProximity(EventPriority.A, null)));

        assertEquals(AdvisorySource.FALLBACK, recommendation.source());
        assertTrue(recommendation.intensity() <= 2);
        assertEquals(recommendation.intensity(), CATALOG.find(recommendation.typeId()).orElseThrow().intensity());
    }

    @Test
    void oracleCandidateOutsideItsPhaseIsDiscarded() {
        WorkoutSelectionEngine engine = oracleEngine(
                "{\"candidates\": [{\"type\": \"sweetspot_intervals\", \"intensity\": 3, \"score\": 1.0}]}");

        Recommendation recommendation = engine.recommend(context(5.0, RecoveryTier.HIGH, TrainingPhase.TAPER, EventProximity.NONE));

        assertEquals(AdvisorySource.FALLBACK, recommendation.source());
    }

    private static SelectionContext context(double form, RecoveryTier recovery, TrainingPhase phase, EventProximity proximity) {
        return new SelectionContext(TODAY, form, recovery, null, null, Map.of(), phase, proximity, 60, 90);
    }

    private static WorkoutSelectionEngine fallbackEngine() {
        return new WorkoutSelectionEngine(CATALOG, SelectionSettings.DEFAULTS, disabledAdvisory());
    }

    private static WorkoutSelectionEngine oracleEngine(String reply) {
        AdvisoryPort port = mock(AdvisoryPort.class);
        when(port.isAvailable()).thenReturn(true);
        when(port.ask(any())).thenReturn(new AdvisoryPort.AdvisoryReply("model", reply));
        OracleSettings settings = new OracleSettings(true, Duration.ofSeconds(5), RetryPolicy.withoutBackoff(1));
        return new WorkoutSelectionEngine(CATALOG, SelectionSettings.DEFAULTS,
                new AdvisoryService(port, settings, new ObjectMapper()));
    }

    private static AdvisoryService disabledAdvisory() {
        return new AdvisoryService(mock(AdvisoryPort.class), OracleSettings.DISABLED, new ObjectMapper());
    }
}
