package com.bko.intervalcoach.advisory;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Optional;

/**
 * Turns the parsed oracle response into a domain value, or empty when nothing usable is in it.
 * Implementations check each field against a fixed schema and drop what does not conform.
 */
@FunctionalInterface
public interface ResponseValidator<T> {
    Optional<T> validate(JsonNode response);
}
