package com.afttsync.infrastructure.upstream;

import java.time.Duration;

/**
 * Exponential backoff settings, independent of what is fetched.
 *
 * @param maxAttempts total attempts, first one included
 * @param baseDelay   sleep before the second attempt
 * @param multiplier  growth factor applied to the delay after each failed attempt
 */
public record RetryPolicy(int maxAttempts, Duration baseDelay, double multiplier) {

    public static final RetryPolicy DEFAULT = new RetryPolicy(3, Duration.ofSeconds(2), 2.0);

    public RetryPolicy {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1, got " + maxAttempts);
        }
        if (baseDelay == null || baseDelay.isNegative()) {
            throw new IllegalArgumentException("baseDelay must be zero or positive");
        }
        if (multiplier < 1.0) {
            throw new IllegalArgumentException("multiplier must be at least 1, got " + multiplier);
        }
    }

    /**
     * Delay to wait after the given failed attempt (1-based): {@code baseDelay * multiplier^(attempt-1)}.
     */
    public Duration delayAfter(int attempt) {
        double factor = Math.pow(multiplier, Math.max(0, attempt - 1));
        return Duration.ofMillis(Math.round(baseDelay.toMillis() * factor));
    }
}
