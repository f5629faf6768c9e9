package com.bko.intervalcoach.advisory.infrastructure.gemini;

import com.bko.intervalcoach.advisory.AdvisoryException;
import com.bko.intervalcoach.advisory.AdvisoryPort;
import com.google.genai.Client;
import com.google.genai.errors.ApiException;
import com.google.genai.errors.ClientException;
import com.google.genai.types.GenerateContentConfig;
import com.google.genai.types.GenerateContentResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class GeminiAdvisoryAdapter implements AdvisoryPort {
    private static final Logger logger = LoggerFactory.getLogger(GeminiAdvisoryAdapter.class);

    private final GeminiProperties properties;
    private Client client;

    public GeminiAdvisoryAdapter(GeminiProperties properties) {
        this.properties = properties;
    }

    @Override
    public boolean isAvailable() {
        return properties.hasApiKey();
    }

    @Override
    public AdvisoryReply ask(AdvisoryPrompt prompt) {
        if (!isAvailable()) {
            throw new AdvisoryException("Gemini API key missing", false);
        }
        String model = properties.defaultModel();
        GenerateContentConfig config = GenerateContentConfig.builder()
                .responseMimeType("application/json")
                .build();
        try {
            logger.debug("Asking {} for {}", model, prompt.purpose());
            GenerateContentResponse response = client().models.generateContent(model, prompt.text(), config);
            String text = response != null ? response.text() : "";
            return new AdvisoryReply(model, text);
        } catch (ClientException e) {
            boolean retryable = e.code() == 408 || e.code() == 429;
            throw new AdvisoryException("Gemini rejected the request: HTTP " + e.code(), e, retryable);
        } catch (ApiException e) {
            throw new AdvisoryException("Gemini error: HTTP " + e.code(), e, true);
        } catch (RuntimeException e) {
            throw new AdvisoryException("Gemini call failed: " + e.getMessage(), e, true);
        }
    }

    private synchronized Client client() {
        if (client == null) {
            client = Client.builder().apiKey(properties.apiKey()).build();
        }
        return client;
    }
}
