package com.bko.intervalcoach.coach.app;

import com.bko.intervalcoach.fitness.ProjectedDay;

import java.util.List;

/**
 * Two projections from the same seed, with and without today's recommended session.
 *
 * @param fitnessDeltaAtHorizon long-average gained by the last projected day
 * @param formDeltaAtHorizon    form difference on the last projected day; positive means the session leaves the athlete fresher
 */
public record ImpactPreview(
        double estimatedLoad,
        List<ProjectedDay> withSession,
        List<ProjectedDay> withoutSession,
        double fitnessDeltaAtHorizon,
        double formDeltaAtHorizon
) {
    public ImpactPreview {
        withSession = List.copyOf(withSession);
        withoutSession = List.copyOf(withoutSession);
    }

    static ImpactPreview of(double estimatedLoad, List<ProjectedDay> withSession, List<ProjectedDay> withoutSession) {
        if (withSession.isEmpty() || withoutSession.isEmpty()) {
            return new ImpactPreview(estimatedLoad, withSession, withoutSession, 0.0, 0.0);
        }
        ProjectedDay with = withSession.get(withSession.size() - 1);
        ProjectedDay without = withoutSession.get(withoutSession.size() - 1);
        return new ImpactPreview(estimatedLoad, withSession, withoutSession,
                round(with.longAverage() - without.longAverage()),
                round(with.form() - without.form()));
    }

    private static double round(double value) {
        return Math.round(value * 10.0) / 10.0;
    }
}
