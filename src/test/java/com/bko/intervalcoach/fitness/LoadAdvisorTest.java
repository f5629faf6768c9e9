package com.bko.intervalcoach.fitness;

import com.bko.intervalcoach.advisory.AdvisoryPort;
import com.bko.intervalcoach.advisory.AdvisoryService;
import com.bko.intervalcoach.advisory.AdvisorySource;
import com.bko.intervalcoach.phase.PhaseState;
import com.bko.intervalcoach.phase.TrainingPhase;
import com.bko.intervalcoach.shared.FitnessSettings;
import com.bko.intervalcoach.shared.OracleSettings;
import com.bko.intervalcoach.shared.RetryPolicy;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.LocalDate;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class LoadAdvisorTest {
    private static final LocalDate TODAY = LocalDate.of(2025, 3, 10);

    @Test
    void rampsByPhase() {
        LoadAdvisor advisor = new LoadAdvisor(FitnessSettings.DEFAULTS, disabledAdvisory());
        FitnessState state = new FitnessState(TODAY, 50.0, 45.0);

        assertEquals(560.0, advisor.deterministic(state, TrainingPhase.BUILD).targetWeeklyLoad());
        assertEquals(518.0, advisor.deterministic(state, TrainingPhase.BASE).targetWeeklyLoad());
        assertEquals(140.0, advisor.deterministic(state, TrainingPhase.TAPER).targetWeeklyLoad());
        assertEquals(-8.0, advisor.deterministic(state, TrainingPhase.RACE_WEEK).rampPerWeek());
    }

    @Test
    void deepFatigueHoldsInsteadOfRamping() {
        LoadAdvisor advisor = new LoadAdvisor(FitnessSettings.DEFAULTS, disabledAdvisory());
        FitnessState fatigued = new FitnessState(TODAY, 50.0, 75.0);

        WeeklyLoadAdvice advice = advisor.deterministic(fatigued, TrainingPhase.BUILD);

        assertEquals(0.0, advice.rampPerWeek());
        assertEquals(350.0, advice.targetWeeklyLoad());
    }

    @Test
    void weeklyTargetNeverNegative() {
        LoadAdvisor advisor = new LoadAdvisor(FitnessSettings.DEFAULTS, disabledAdvisory());

        WeeklyLoadAdvice advice = advisor.deterministic(FitnessState.coldStart(TODAY), TrainingPhase.RACE_WEEK);

        assertEquals(0.0, advice.targetWeeklyLoad());
    }

    @Test
    void acceptsPlausibleOracleTarget() {
        LoadAdvisor advisor = new LoadAdvisor(FitnessSettings.DEFAULTS,
                oracleReplying("{\"weeklyLoad\": 600, \"rampPerWeek\": 6, \"rationale\": \"Room to push\"}"));

        WeeklyLoadAdvice advice = advisor.advise(new FitnessState(TODAY, 50.0, 45.0), phase(TrainingPhase.BUILD));

        assertEquals(600.0, advice.targetWeeklyLoad());
        assertEquals(6.0, advice.rampPerWeek());
        assertEquals("Room to push", advice.rationale());
        assertEquals(AdvisorySource.ORACLE, advice.source());
    }

    @Test
    void discardsImplausibleOracleTarget() {
        LoadAdvisor advisor = new LoadAdvisor(FitnessSettings.DEFAULTS,
                oracleReplying("{\"weeklyLoad\": 5000, \"rationale\": \"Go big\"}"));

        WeeklyLoadAdvice advice = advisor.advise(new FitnessState(TODAY, 50.0, 45.0), phase(TrainingPhase.BUILD));

        assertEquals(560.0, advice.targetWeeklyLoad());
        assertEquals(AdvisorySource.FALLBACK, advice.source());
    }

    private static PhaseState phase(TrainingPhase phase) {
        return new PhaseState(phase, 10, phase.focus(), null, null, AdvisorySource.FALLBACK);
    }

    private static AdvisoryService disabledAdvisory() {
        return new AdvisoryService(mock(AdvisoryPort.class), OracleSettings.DISABLED, new ObjectMapper());
    }

    private static AdvisoryService oracleReplying(String text) {
        AdvisoryPort port = mock(AdvisoryPort.class);
        when(port.isAvailable()).thenReturn(true);
        when(port.ask(any())).thenReturn(new AdvisoryPort.AdvisoryReply("model", text));
        OracleSettings settings = new OracleSettings(true, Duration.ofSeconds(5), RetryPolicy.withoutBackoff(1));
        return new AdvisoryService(port, settings, new ObjectMapper());
    }
}
