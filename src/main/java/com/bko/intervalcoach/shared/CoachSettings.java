package com.bko.intervalcoach.shared;

public record CoachSettings(
        FitnessSettings fitness,
        ProgressionSettings progression,
        SelectionSettings selection,
        OracleSettings oracle,
        RetryPolicy providerRetry,
        int historyDays
) {
    public static CoachSettings defaults() {
        return new CoachSettings(
                FitnessSettings.DEFAULTS,
                ProgressionSettings.DEFAULTS,
                SelectionSettings.DEFAULTS,
                OracleSettings.DISABLED,
                RetryPolicy.DEFAULT,
                120);
    }
}
