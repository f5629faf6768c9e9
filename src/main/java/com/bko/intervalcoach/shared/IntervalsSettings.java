package com.bko.intervalcoach.shared;

public record IntervalsSettings(String athleteId, String apiKey, String baseUrl) {
    public static final String DEFAULT_BASE_URL = "https://intervals.icu/api/v1";

    public IntervalsSettings {
        if (baseUrl == null || baseUrl.isBlank()) {
            baseUrl = DEFAULT_BASE_URL;
        }
    }

    public boolean isConfigured() {
        return hasText(athleteId) && hasText(apiKey);
    }

    private boolean hasText(String value) {
        return value != null && !value.isBlank();
    }
}
