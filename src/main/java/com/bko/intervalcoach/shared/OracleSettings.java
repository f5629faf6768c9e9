package com.bko.intervalcoach.shared;

import java.time.Duration;

public record OracleSettings(boolean enabled, Duration timeout, RetryPolicy retry) {
    public static final OracleSettings DISABLED =
            new OracleSettings(false, Duration.ofSeconds(30), RetryPolicy.DEFAULT);

    public OracleSettings {
        if (timeout == null || timeout.isNegative() || timeout.isZero()) {
            throw new IllegalArgumentException("Oracle timeout must be positive");
        }
        if (retry == null) {
            retry = RetryPolicy.DEFAULT;
        }
    }
}
