package com.bko.intervalcoach.curve;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.OptionalDouble;

/**
 * Derives threshold and anaerobic capacity from provider readings and the best-effort curve.
 * <p>
 * Threshold: provider estimate, then a two-parameter critical-power fit through the 3 and
 * 12 minute bests, then 95% of the 20 minute best, then the manual threshold.
 * Anaerobic capacity: provider figure, then the W' of the same critical-power fit.
 */
@Component
public class CurveAnalyzer {
    private static final Logger logger = LoggerFactory.getLogger(CurveAnalyzer.class);
    private static final int SHORT_EFFORT_SECONDS = 180;
    private static final int LONG_EFFORT_SECONDS = 720;
    private static final int TWENTY_MINUTES = 1200;
    private static final int SPRINT_SECONDS = 5;
    private static final double TWENTY_MINUTE_FACTOR = 0.95;

    public AthleteProfile analyze(AthleteReadings readings, PowerCurve curve) {
        AthleteReadings r = readings == null ? AthleteReadings.none() : readings;
        PowerCurve c = curve == null ? PowerCurve.empty() : curve;
        CriticalPowerFit fit = fitCriticalPower(c);

        Double threshold = null;
        ThresholdModel model = ThresholdModel.NONE;
        if (isPositive(r.estimatedThreshold())) {
            threshold = r.estimatedThreshold();
            model = ThresholdModel.PROVIDER_ESTIMATE;
        } else if (fit != null) {
            threshold = round(fit.criticalPower());
            model = ThresholdModel.CRITICAL_POWER;
        } else {
            OptionalDouble twenty = c.peakAt(TWENTY_MINUTES);
            if (twenty.isPresent()) {
                threshold = round(twenty.getAsDouble() * TWENTY_MINUTE_FACTOR);
                model = ThresholdModel.TWENTY_MINUTE;
            } else if (isPositive(r.manualThreshold())) {
                threshold = r.manualThreshold();
                model = ThresholdModel.MANUAL;
            }
        }

        Double anaerobicCapacity = null;
        if (isPositive(r.anaerobicCapacity())) {
            anaerobicCapacity = r.anaerobicCapacity();
        } else if (fit != null) {
            anaerobicCapacity = round(fit.anaerobicCapacity());
        }

        Double seasonBest = threshold;
        if (isPositive(r.seasonBestThreshold()) && (seasonBest == null || r.seasonBestThreshold() > seasonBest)) {
            seasonBest = r.seasonBestThreshold();
        }

        OptionalDouble sprint = c.bestUpTo(SPRINT_SECONDS);
        Double maxPower = sprint.isPresent() ? round(sprint.getAsDouble()) : null;

        logger.debug("Threshold {} W from {}, W' {} J, peak {} W", threshold, model, anaerobicCapacity, maxPower);
        return new AthleteProfile(r.weightKg(), r.manualThreshold(), threshold, seasonBest,
                anaerobicCapacity, maxPower, model);
    }

    /**
     * Work-time fit {@code W = CP * t + W'} through two curve points; null when the points are
     * missing or the fit is not physical.
     */
    CriticalPowerFit fitCriticalPower(PowerCurve curve) {
        OptionalDouble shortEffort = curve.peakAt(SHORT_EFFORT_SECONDS);
        OptionalDouble longEffort = curve.peakAt(LONG_EFFORT_SECONDS);
        if (shortEffort.isEmpty() || longEffort.isEmpty()) {
            return null;
        }
        double shortWork = shortEffort.getAsDouble() * SHORT_EFFORT_SECONDS;
        double longWork = longEffort.getAsDouble() * LONG_EFFORT_SECONDS;
        double criticalPower = (longWork - shortWork) / (LONG_EFFORT_SECONDS - SHORT_EFFORT_SECONDS);
        double anaerobicCapacity = shortWork - criticalPower * SHORT_EFFORT_SECONDS;
        if (criticalPower <= 0 || anaerobicCapacity <= 0) {
            return null;
        }
        return new CriticalPowerFit(criticalPower, anaerobicCapacity);
    }

    private static boolean isPositive(Double value) {
        return value != null && value > 0;
    }

    private static double round(double value) {
        return Math.round(value * 10.0) / 10.0;
    }

    record CriticalPowerFit(double criticalPower, double anaerobicCapacity) {
    }
}
