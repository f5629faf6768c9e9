package com.bko.intervalcoach.shared;

public record AppSettings(IntervalsSettings intervals, CoachSettings coach) {
    public boolean isIntervalsConfigured() {
        return intervals != null && intervals.isConfigured();
    }

    public boolean isOracleEnabled() {
        return coach != null && coach.oracle().enabled();
    }
}
