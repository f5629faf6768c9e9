package com.bko.intervalcoach.advisory;

import java.util.Objects;

/**
 * A value together with where it came from.
 */
public record Advised<T>(T value, AdvisorySource source) {
    public Advised {
        Objects.requireNonNull(value, "value");
        Objects.requireNonNull(source, "source");
    }

    public static <T> Advised<T> fromOracle(T value) {
        return new Advised<>(value, AdvisorySource.ORACLE);
    }

    public static <T> Advised<T> fallback(T value) {
        return new Advised<>(value, AdvisorySource.FALLBACK);
    }

    public boolean isFromOracle() {
        return source == AdvisorySource.ORACLE;
    }
}
