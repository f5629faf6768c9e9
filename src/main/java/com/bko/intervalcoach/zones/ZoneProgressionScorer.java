package com.bko.intervalcoach.zones;

import com.bko.intervalcoach.shared.ProgressionSettings;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import static java.time.temporal.ChronoUnit.DAYS;

/**
 * Scores accumulated volume, frequency and recency per category over a rolling window.
 */
@Component
public class ZoneProgressionScorer {
    private static final int RECENT_DAYS = 14;
    private static final double MAX_VOLUME_SCORE = 7.0;
    private static final double MAX_FREQUENCY_BONUS = 2.0;
    private static final double PLATEAU_TOLERANCE = 0.05;

    private final ProgressionSettings settings;

    public ZoneProgressionScorer(ProgressionSettings settings) {
        this.settings = settings;
    }

    public Map<ProgressionCategory, ZoneProgression> score(List<ZoneExposure> exposures, LocalDate asOf) {
        return score(exposures, settings.windowDays(), asOf, Map.of());
    }

    /**
     * @param previousLevels levels of each category in the retained prior runs, used for plateau detection
     */
    public Map<ProgressionCategory, ZoneProgression> score(List<ZoneExposure> exposures,
                                                           int windowDays,
                                                           LocalDate asOf,
                                                           Map<ProgressionCategory, List<Double>> previousLevels) {
        if (windowDays < 1) {
            throw new IllegalArgumentException("Scoring window must be at least 1 day: " + windowDays);
        }
        LocalDate windowStart = asOf.minusDays(windowDays - 1L);
        List<ZoneExposure> inWindow = new ArrayList<>();
        if (exposures != null) {
            for (ZoneExposure exposure : exposures) {
                if (!exposure.date().isBefore(windowStart) && !exposure.date().isAfter(asOf)) {
                    inWindow.add(exposure);
                }
            }
        }

        Map<ProgressionCategory, ZoneProgression> result = new EnumMap<>(ProgressionCategory.class);
        for (ProgressionCategory category : ProgressionCategory.values()) {
            if (inWindow.isEmpty()) {
                result.put(category, ZoneProgression.untrained(category));
            } else {
                List<Double> prior = previousLevels == null ? List.of() : previousLevels.getOrDefault(category, List.of());
                result.put(category, scoreCategory(category, inWindow, windowDays, asOf, prior));
            }
        }
        return Collections.unmodifiableMap(result);
    }

    private ZoneProgression scoreCategory(ProgressionCategory category,
                                          List<ZoneExposure> exposures,
                                          int windowDays,
                                          LocalDate asOf,
                                          List<Double> priorLevels) {
        double minutes = 0.0;
        double loadSum = 0.0;
        int sessions = 0;
        int recentSessions = 0;
        LocalDate lastTrained = null;

        for (ZoneExposure exposure : exposures) {
            double sessionMinutes = category.minutesIn(exposure);
            minutes += sessionMinutes;
            if (sessionMinutes < category.minSessionMinutes()) {
                continue;
            }
            sessions++;
            loadSum += exposure.load();
            if (DAYS.between(exposure.date(), asOf) < RECENT_DAYS) {
                recentSessions++;
            }
            if (lastTrained == null || exposure.date().isAfter(lastTrained)) {
                lastTrained = exposure.date();
            }
        }

        double baseline = category.baselineMinutes() * windowDays / 28.0;
        double volumeScore = Math.min(MAX_VOLUME_SCORE, 5.0 * minutes / baseline);
        double sessionsPerWeek = sessions / (windowDays / 7.0);
        double frequencyBonus = Math.min(MAX_FREQUENCY_BONUS, sessionsPerWeek);
        double recencyBonus = recencyBonus(lastTrained, asOf);
        double level = round(clamp(volumeScore + frequencyBonus + recencyBonus));

        ProgressionTrend trend = trend(lastTrained, recentSessions, asOf);
        if (recentSessions > 0 && isPlateau(level, priorLevels)) {
            trend = ProgressionTrend.PLATEAUED;
        }
        double averageLoad = sessions == 0 ? 0.0 : round(loadSum / sessions);
        return new ZoneProgression(category, level, trend, lastTrained, sessions, averageLoad, round(minutes));
    }

    private double recencyBonus(LocalDate lastTrained, LocalDate asOf) {
        if (lastTrained == null) {
            return 0.0;
        }
        long daysSince = DAYS.between(lastTrained, asOf);
        if (daysSince <= 7) {
            return 1.0;
        } else if (daysSince <= 14) {
            return 0.6;
        } else if (daysSince <= 21) {
            return 0.3;
        }
        return 0.0;
    }

    private ProgressionTrend trend(LocalDate lastTrained, int recentSessions, LocalDate asOf) {
        if (recentSessions >= 2) {
            return ProgressionTrend.IMPROVING;
        }
        if (lastTrained != null && DAYS.between(lastTrained, asOf) > RECENT_DAYS) {
            return ProgressionTrend.DECLINING;
        }
        return ProgressionTrend.STABLE;
    }

    private boolean isPlateau(double level, List<Double> priorLevels) {
        if (priorLevels.isEmpty()) {
            return false;
        }
        for (Double prior : priorLevels) {
            if (prior == null || Math.abs(prior - level) > PLATEAU_TOLERANCE) {
                return false;
            }
        }
        return true;
    }

    private static double clamp(double level) {
        return Math.max(ZoneProgression.MIN_LEVEL, Math.min(ZoneProgression.MAX_LEVEL, level));
    }

    private static double round(double value) {
        return BigDecimal.valueOf(value).setScale(1, RoundingMode.HALF_UP).doubleValue();
    }
}
