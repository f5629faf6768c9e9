package com.bko.intervalcoach.coach.app;

import com.bko.intervalcoach.workout.Recommendation;

/**
 * Training stress of a planned session: hours x IF^2 x 100, with the intensity factor looked up by intensity.
 */
final class SessionLoadEstimator {
    private static final double[] INTENSITY_FACTOR = {0.0, 0.55, 0.70, 0.85, 0.95, 1.05};

    private SessionLoadEstimator() {
    }

    static double estimate(Recommendation recommendation) {
        double minutes = (recommendation.minDurationMinutes() + recommendation.maxDurationMinutes()) / 2.0;
        return estimate(minutes, recommendation.intensity());
    }

    static double estimate(double minutes, int intensity) {
        if (intensity < 1 || intensity > 5) {
            throw new IllegalArgumentException("Intensity must be within 1..5: " + intensity);
        }
        double factor = INTENSITY_FACTOR[intensity];
        return Math.max(0.0, minutes / 60.0) * factor * factor * 100.0;
    }
}
