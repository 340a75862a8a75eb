package com.entity.canonical.lock;

import java.time.Duration;

/**
 * How long a fit waits for another fit of the same entity type to finish.
 */
public record LockConfig(Duration timeout) {

    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(30);

    public LockConfig {
        if (timeout == null || timeout.isNegative() || timeout.isZero()) {
            throw new IllegalArgumentException("timeout must be positive, got " + timeout);
        }
    }

    public static LockConfig defaults() {
        return new LockConfig(DEFAULT_TIMEOUT);
    }

    public static LockConfig withTimeout(long timeoutMs) {
        return new LockConfig(Duration.ofMillis(timeoutMs));
    }
}
