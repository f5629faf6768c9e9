package com.bko.intervalcoach.shared;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.Duration;

@Configuration
public class SettingsConfiguration {

    @Bean
    public AppSettings appSettings(EnvConfig envConfig) {
        IntervalsSettings intervals = new IntervalsSettings(
                envConfig.get("intervals.athlete_id"),
                envConfig.get("intervals.api_key"),
                envConfig.get("intervals.base_url")
        );
        return new AppSettings(intervals, buildCoachSettings(envConfig));
    }

    @Bean
    public CoachSettings coachSettings(AppSettings appSettings) {
        return appSettings.coach();
    }

    @Bean
    public FitnessSettings fitnessSettings(CoachSettings coachSettings) {
        return coachSettings.fitness();
    }

    @Bean
    public ProgressionSettings progressionSettings(CoachSettings coachSettings) {
        return coachSettings.progression();
    }

    @Bean
    public SelectionSettings selectionSettings(CoachSettings coachSettings) {
        return coachSettings.selection();
    }

    @Bean
    public OracleSettings oracleSettings(CoachSettings coachSettings) {
        return coachSettings.oracle();
    }

    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }

    private CoachSettings buildCoachSettings(EnvConfig envConfig) {
        FitnessSettings fitness = new FitnessSettings(
                envConfig.getInt("coach.fitness.long_constant", FitnessSettings.DEFAULTS.longTimeConstant()),
                envConfig.getInt("coach.fitness.short_constant", FitnessSettings.DEFAULTS.shortTimeConstant())
        );
        ProgressionSettings progression = new ProgressionSettings(
                envConfig.getInt("coach.progression.window_days", ProgressionSettings.DEFAULTS.windowDays()),
                envConfig.getInt("coach.progression.plateau_runs", ProgressionSettings.DEFAULTS.plateauRetentionRuns()),
                envConfig.getInt("coach.progression.plateau_days", ProgressionSettings.DEFAULTS.plateauRetentionDays())
        );
        SelectionSettings selection = new SelectionSettings(
                envConfig.getInt("coach.selection.default_ceiling", SelectionSettings.DEFAULTS.defaultCeiling()),
                envConfig.getInt("coach.selection.min_minutes", SelectionSettings.DEFAULTS.minDurationMinutes()),
                envConfig.getInt("coach.selection.max_minutes", SelectionSettings.DEFAULTS.maxDurationMinutes()),
                envConfig.getInt("coach.selection.variety_days", SelectionSettings.DEFAULTS.varietyWindowDays()),
                envConfig.getInt("coach.selection.max_alternates", SelectionSettings.DEFAULTS.maxAlternates())
        );
        RetryPolicy oracleRetry = new RetryPolicy(
                envConfig.getInt("coach.oracle.max_attempts", 3),
                Duration.ofMillis(envConfig.getInt("coach.oracle.backoff_ms", 2000)),
                2.0,
                Duration.ofSeconds(20));
        OracleSettings oracle = new OracleSettings(
                envConfig.getBoolean("coach.oracle.enabled", true),
                Duration.ofSeconds(envConfig.getInt("coach.oracle.timeout_seconds", 60)),
                oracleRetry);
        RetryPolicy providerRetry = new RetryPolicy(
                envConfig.getInt("intervals.max_attempts", 3),
                Duration.ofMillis(envConfig.getInt("intervals.backoff_ms", 1000)),
                2.0,
                Duration.ofSeconds(10));
        return new CoachSettings(fitness, progression, selection, oracle, providerRetry,
                envConfig.getInt("coach.history_days", 120));
    }
}
