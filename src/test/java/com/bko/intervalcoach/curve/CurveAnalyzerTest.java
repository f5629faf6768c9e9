package com.bko.intervalcoach.curve;

import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

class CurveAnalyzerTest {
    private final CurveAnalyzer analyzer = new CurveAnalyzer();

    @Test
    void providerEstimateWinsOverTheCurve() {
        AthleteProfile profile = analyzer.analyze(
                new AthleteReadings(70.0, 250.0, 270.0, null, null),
                PowerCurve.normalize(Map.of(180, 380.0, 720, 300.0)));

        assertEquals(270.0, profile.currentThreshold());
        assertEquals(ThresholdModel.PROVIDER_ESTIMATE, profile.thresholdModel());
        assertEquals(19200.0, profile.anaerobicCapacity());
    }

    @Test
    void criticalPowerFitIsUsedWithoutProviderEstimate() {
        AthleteProfile profile = analyzer.analyze(
                new AthleteReadings(70.0, 250.0, null, null, null),
                PowerCurve.normalize(Map.of(180, 380.0, 720, 300.0, 1200, 280.0)));

        assertEquals(273.3, profile.currentThreshold());
        assertEquals(ThresholdModel.CRITICAL_POWER, profile.thresholdModel());
        assertEquals(19200.0, profile.anaerobicCapacity());
        assertEquals(3.9, profile.thresholdPerKg());
    }

    @Test
    void twentyMinuteBestIsNextInLine() {
        AthleteProfile profile = analyzer.analyze(
                new AthleteReadings(null, 250.0, null, null, null),
                PowerCurve.normalize(Map.of(1200, 280.0, 1800, 260.0)));

        assertEquals(266.0, profile.currentThreshold());
        assertEquals(ThresholdModel.TWENTY_MINUTE, profile.thresholdModel());
        assertNull(profile.anaerobicCapacity());
    }

    @Test
    void manualThresholdIsTheLastResort() {
        AthleteProfile manual = analyzer.analyze(new AthleteReadings(null, 250.0, null, null, null), PowerCurve.empty());
        AthleteProfile nothing = analyzer.analyze(null, null);

        assertEquals(250.0, manual.currentThreshold());
        assertEquals(ThresholdModel.MANUAL, manual.thresholdModel());
        assertNull(nothing.currentThreshold());
        assertEquals(ThresholdModel.NONE, nothing.thresholdModel());
    }

    @Test
    void seasonBestIsAtLeastTheCurrentThreshold() {
        AthleteProfile higherSeason = analyzer.analyze(new AthleteReadings(null, null, 270.0, 285.0, null), PowerCurve.empty());
        AthleteProfile lowerSeason = analyzer.analyze(new AthleteReadings(null, null, 270.0, 260.0, null), PowerCurve.empty());

        assertEquals(285.0, higherSeason.seasonBestThreshold());
        assertEquals(270.0, lowerSeason.seasonBestThreshold());
    }

    @Test
    void providerAnaerobicCapacityAndSprintPeak() {
        AthleteProfile profile = analyzer.analyze(
                new AthleteReadings(null, null, 270.0, null, 21000.0),
                PowerCurve.normalize(Map.of(1, 1100.0, 5, 1000.0, 60, 500.0)));

        assertEquals(21000.0, profile.anaerobicCapacity());
        assertEquals(1100.0, profile.maxPower());
    }

    @Test
    void unphysicalFitIsDiscarded() {
        // a flat curve gives W' = 0
        assertNull(analyzer.fitCriticalPower(PowerCurve.normalize(Map.of(180, 300.0, 720, 300.0))));
    }
}
