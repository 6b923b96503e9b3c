package io.vidsort4j.retry;

import java.time.Duration;
import java.util.Objects;

/**
 * Backoff parameters.
 *
 * @param baseDelay   delay before the first retry is {@code baseDelay * 2}
 * @param maxDelay    cap on any single delay
 * @param maxAttempts attempts after which every failure is terminal; {@code <= 0} disables the cap
 */
public record RetryPolicy(Duration baseDelay, Duration maxDelay, int maxAttempts) {

    public static final RetryPolicy DEFAULTS = new RetryPolicy(Duration.ofSeconds(10), Duration.ofMinutes(10), 5);

    public RetryPolicy {
        Objects.requireNonNull(baseDelay, "baseDelay must not be null");
        Objects.requireNonNull(maxDelay, "maxDelay must not be null");
        if (baseDelay.isNegative() || baseDelay.isZero()) {
            throw new IllegalArgumentException("baseDelay must be a positive duration");
        }
        if (maxDelay.compareTo(baseDelay) < 0) {
            throw new IllegalArgumentException("maxDelay must not be shorter than baseDelay");
        }
    }
}
