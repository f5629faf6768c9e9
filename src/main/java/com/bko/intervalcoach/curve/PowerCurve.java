package com.bko.intervalcoach.curve;

import java.util.Collections;
import java.util.Map;
import java.util.NavigableMap;
import java.util.OptionalDouble;
import java.util.TreeMap;

/**
 * Best-effort output indexed by effort duration in seconds.
 */
public final class PowerCurve {
    private final NavigableMap<Integer, Double> wattsByDuration;

    private PowerCurve(NavigableMap<Integer, Double> wattsByDuration) {
        this.wattsByDuration = Collections.unmodifiableNavigableMap(wattsByDuration);
    }

    public static PowerCurve empty() {
        return new PowerCurve(new TreeMap<>());
    }

    /**
     * Builds a peak-output curve from raw bests: non-positive durations and outputs are dropped and
     * every duration is lifted to at least the output of any longer duration, so the curve never
     * increases with duration.
     */
    public static PowerCurve normalize(Map<Integer, Double> rawBests) {
        TreeMap<Integer, Double> cleaned = new TreeMap<>();
        if (rawBests != null) {
            rawBests.forEach((seconds, watts) -> {
                if (seconds != null && seconds > 0 && watts != null && watts > 0 && Double.isFinite(watts)) {
                    cleaned.merge(seconds, watts, Math::max);
                }
            });
        }
        double longerBest = 0.0;
        for (Integer seconds : cleaned.descendingKeySet()) {
            double value = Math.max(cleaned.get(seconds), longerBest);
            cleaned.put(seconds, value);
            longerBest = value;
        }
        return new PowerCurve(cleaned);
    }

    public boolean isEmpty() {
        return wattsByDuration.isEmpty();
    }

    public NavigableMap<Integer, Double> points() {
        return wattsByDuration;
    }

    /**
     * Output at the given duration, interpolated linearly between neighbouring points.
     * Empty outside the recorded duration range.
     */
    public OptionalDouble peakAt(int seconds) {
        Double exact = wattsByDuration.get(seconds);
        if (exact != null) {
            return OptionalDouble.of(exact);
        }
        Map.Entry<Integer, Double> lower = wattsByDuration.lowerEntry(seconds);
        Map.Entry<Integer, Double> higher = wattsByDuration.higherEntry(seconds);
        if (lower == null || higher == null) {
            return OptionalDouble.empty();
        }
        double fraction = (double) (seconds - lower.getKey()) / (higher.getKey() - lower.getKey());
        return OptionalDouble.of(lower.getValue() + fraction * (higher.getValue() - lower.getValue()));
    }

    /**
     * Highest output recorded for efforts up to the given duration.
     */
    public OptionalDouble bestUpTo(int seconds) {
        return wattsByDuration.headMap(seconds, true).values().stream()
                .mapToDouble(Double::doubleValue)
                .max();
    }
}
