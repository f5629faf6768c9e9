package com.bko.intervalcoach.advisory.infrastructure.gemini;

public record GeminiProperties(String apiKey, String defaultModel) {
    public boolean hasApiKey() {
        return apiKey != null && !apiKey.isBlank();
    }
}
