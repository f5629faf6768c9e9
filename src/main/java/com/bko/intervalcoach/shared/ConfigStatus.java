package com.bko.intervalcoach.shared;

public record ConfigStatus(boolean intervalsConfigured, boolean oracleEnabled) {
    public static ConfigStatus from(AppSettings settings) {
        return new ConfigStatus(
                settings.isIntervalsConfigured(),
                settings.isOracleEnabled()
        );
    }
}
