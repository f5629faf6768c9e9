package com.bko.intervalcoach.workout;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.OptionalDouble;

/**
 * Reduces wellness telemetry to a recovery tier. Each warning sign (HRV under its 7-day baseline,
 * short or poor sleep, poor subjective recovery) costs one step from HIGH.
 */
@Component
public class RecoveryAssessor {
    private static final Logger logger = LoggerFactory.getLogger(RecoveryAssessor.class);
    private static final int BASELINE_DAYS = 7;
    private static final double HRV_DROP_RATIO = 0.90;
    private static final double MIN_SLEEP_HOURS = 6.0;
    private static final int MIN_SLEEP_SCORE = 60;

    public RecoveryTier assess(List<WellnessReading> readings) {
        if (readings == null || readings.isEmpty()) {
            return RecoveryTier.MODERATE;
        }
        List<WellnessReading> sorted = new ArrayList<>(readings);
        sorted.sort(Comparator.comparing(WellnessReading::date));
        WellnessReading latest = sorted.get(sorted.size() - 1);
        if (!hasTelemetry(latest)) {
            return RecoveryTier.MODERATE;
        }

        int penalties = 0;
        if (latest.hrv() != null) {
            OptionalDouble baseline = sorted.subList(Math.max(0, sorted.size() - 1 - BASELINE_DAYS), sorted.size() - 1)
                    .stream()
                    .filter(r -> r.hrv() != null && r.hrv() > 0)
                    .mapToDouble(WellnessReading::hrv)
                    .average();
            if (baseline.isPresent() && latest.hrv() <= baseline.getAsDouble() * HRV_DROP_RATIO) {
                penalties++;
            }
        }
        if ((latest.sleepHours() != null && latest.sleepHours() < MIN_SLEEP_HOURS)
                || (latest.sleepScore() != null && latest.sleepScore() < MIN_SLEEP_SCORE)) {
            penalties++;
        }
        if (isPoorReadiness(latest.readiness())) {
            penalties++;
        }

        RecoveryTier tier = penalties == 0 ? RecoveryTier.HIGH
                : penalties == 1 ? RecoveryTier.MODERATE
                : RecoveryTier.LOW;
        logger.debug("Recovery on {}: {} warning sign(s), tier {}", latest.date(), penalties, tier);
        return tier;
    }

    private boolean hasTelemetry(WellnessReading reading) {
        return reading.hrv() != null || reading.sleepHours() != null
                || reading.sleepScore() != null || reading.readiness() != null;
    }

    private boolean isPoorReadiness(Integer readiness) {
        if (readiness == null) {
            return false;
        }
        if (readiness <= 4) {
            return readiness >= 3;
        }
        return readiness < 40;
    }
}
