package com.bko.intervalcoach.advisory;

/**
 * Failure talking to the oracle. Non-retryable failures (bad request, rejected credentials) stop
 * the retry loop immediately.
 */
public class AdvisoryException extends RuntimeException {
    private final boolean retryable;

    public AdvisoryException(String message, boolean retryable) {
        super(message);
        this.retryable = retryable;
    }

    public AdvisoryException(String message, Throwable cause, boolean retryable) {
        super(message, cause);
        this.retryable = retryable;
    }

    public boolean isRetryable() {
        return retryable;
    }
}
