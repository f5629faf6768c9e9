package com.bko.intervalcoach.advisory;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * Reads the oracle's reply text as a single JSON object. The object may be wrapped in one
 * fenced code block; any other surrounding text makes the reply invalid.
 */
public final class OracleResponseReader {
    private static final Logger logger = LoggerFactory.getLogger(OracleResponseReader.class);
    private static final String FENCE = "```";

    private final ObjectMapper objectMapper;

    public OracleResponseReader(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public Optional<JsonNode> read(String text) {
        if (text == null || text.isBlank()) {
            return Optional.empty();
        }
        String body = unfence(text.trim());
        try {
            JsonNode node = objectMapper.readTree(body);
            if (node == null || !node.isObject()) {
                logger.debug("Oracle reply is not a JSON object");
                return Optional.empty();
            }
            return Optional.of(node);
        } catch (JsonProcessingException e) {
            logger.debug("Oracle reply is not valid JSON: {}", e.getOriginalMessage());
            return Optional.empty();
        }
    }

    private String unfence(String text) {
        if (!text.startsWith(FENCE) || !text.endsWith(FENCE) || text.length() < 2 * FENCE.length()) {
            return text;
        }
        String inner = text.substring(FENCE.length(), text.length() - FENCE.length());
        int newline = inner.indexOf('\n');
        if (newline >= 0 && inner.substring(0, newline).trim().matches("[A-Za-z]*")) {
            inner = inner.substring(newline + 1);
        }
        return inner.trim();
    }

    /**
     * Text field, or null when absent, not textual, or blank.
     */
    public static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || !value.isTextual() || value.asText().isBlank()) {
            return null;
        }
        return value.asText().trim();
    }

    /**
     * Integral number field, or null when absent or not an integral number.
     */
    public static Integer integer(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || !value.isNumber()) {
            return null;
        }
        double number = value.asDouble();
        if (number != Math.rint(number)) {
            return null;
        }
        return (int) number;
    }

    /**
     * Finite number field, or null when absent or not a number.
     */
    public static Double number(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || !value.isNumber()) {
            return null;
        }
        double number = value.asDouble();
        return Double.isFinite(number) ? number : null;
    }
}
