package com.bko.intervalcoach.advisory.infrastructure.gemini;

import com.bko.intervalcoach.shared.EnvConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.env.Environment;

import java.util.stream.Stream;

/**
 * Gemini credentials and model. Spring properties win over the .env file.
 */
@Configuration
public class GeminiConfiguration {
    private static final Logger logger = LoggerFactory.getLogger(GeminiConfiguration.class);
    static final String DEFAULT_MODEL = "gemini-2.0-flash";

    @Bean
    public GeminiProperties geminiProperties(Environment environment, EnvConfig envConfig) {
        String apiKey = firstPresent(
                environment.getProperty("coach.oracle.gemini.api-key"),
                environment.getProperty("GEMINI_API_KEY"),
                envConfig.get("gemini.api_key"));
        String model = firstPresent(
                environment.getProperty("coach.oracle.gemini.model"),
                envConfig.get("gemini.model"),
                DEFAULT_MODEL);

        GeminiProperties properties = new GeminiProperties(apiKey, model);
        if (!properties.hasApiKey()) {
            logger.info("No Gemini API key configured; recommendations use the rule-based fallback only.");
        }
        return properties;
    }

    private static String firstPresent(String... candidates) {
        return Stream.of(candidates)
                .filter(value -> value != null && !value.isBlank())
                .findFirst()
                .orElse(null);
    }
}
