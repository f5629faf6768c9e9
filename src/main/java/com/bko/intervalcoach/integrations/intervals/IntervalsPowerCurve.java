package com.bko.intervalcoach.integrations.intervals;

import java.util.List;

/**
 * Best-effort power for one curve window, with the provider's model estimates for that window.
 *
 * @param secs  effort durations in seconds
 * @param watts best power for the duration at the same index
 */
public record IntervalsPowerCurve(String label, List<Integer> secs, List<Double> watts, Double eftp, Double wPrime) {
    public IntervalsPowerCurve {
        secs = secs == null ? List.of() : List.copyOf(secs);
        watts = watts == null ? List.of() : List.copyOf(watts);
    }
}
