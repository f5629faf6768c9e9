package com.bko.intervalcoach.shared;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Duration;
import java.util.function.Predicate;

/**
 * Bounded retry with exponential backoff for calls to external services.
 * Backoff grows as {@code initialBackoff * multiplier^(attempt-1)}, capped at {@code maxBackoff}.
 */
public record RetryPolicy(int maxAttempts, Duration initialBackoff, double multiplier, Duration maxBackoff) {
    private static final Logger logger = LoggerFactory.getLogger(RetryPolicy.class);

    public static final RetryPolicy DEFAULT =
            new RetryPolicy(3, Duration.ofSeconds(2), 2.0, Duration.ofSeconds(20));

    public RetryPolicy {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1");
        }
        if (initialBackoff == null || initialBackoff.isNegative()) {
            throw new IllegalArgumentException("initialBackoff must not be negative");
        }
        if (multiplier < 1.0) {
            throw new IllegalArgumentException("multiplier must be >= 1.0");
        }
        if (maxBackoff == null || maxBackoff.compareTo(initialBackoff) < 0) {
            maxBackoff = initialBackoff;
        }
    }

    public static RetryPolicy withoutBackoff(int maxAttempts) {
        return new RetryPolicy(maxAttempts, Duration.ZERO, 1.0, Duration.ZERO);
    }

    /**
     * Delay before the retry that follows the given (1-based) failed attempt.
     */
    public Duration backoffAfter(int attempt) {
        double factor = Math.pow(multiplier, Math.max(0, attempt - 1));
        long millis = (long) Math.min(initialBackoff.toMillis() * factor, (double) maxBackoff.toMillis());
        return Duration.ofMillis(millis);
    }

    /**
     * Runs the call until it succeeds, the attempts are exhausted, or it fails with an exception
     * the {@code retryable} predicate rejects. The last failure is rethrown unchanged.
     */
    public <T> T execute(String operation,
                         RetryableCall<T> call,
                         Predicate<Exception> retryable) throws IOException {
        int attempt = 1;
        while (true) {
            try {
                return call.call();
            } catch (IOException | RuntimeException e) {
                if (attempt >= maxAttempts || !retryable.test(e)) {
                    if (attempt > 1) {
                        logger.warn("{} failed after {} attempt(s): {}", operation, attempt, e.getMessage());
                    }
                    throw e;
                }
                Duration delay = backoffAfter(attempt);
                logger.info("{} failed (attempt {}/{}), retrying in {} ms: {}",
                        operation, attempt, maxAttempts, delay.toMillis(), e.getMessage());
                if (!pause(delay)) {
                    throw e;
                }
                attempt++;
            }
        }
    }

    private boolean pause(Duration delay) {
        if (delay.isZero()) {
            return true;
        }
        try {
            Thread.sleep(delay.toMillis());
            return true;
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    @FunctionalInterface
    public interface RetryableCall<T> {
        T call() throws IOException;
    }
}
