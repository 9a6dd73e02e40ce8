package com.ruach.formation.application.guard;

import java.util.List;

/**
 * Backoff settings for {@link RetryExecutor}.
 *
 * @param maxAttempts       total attempts, including the first
 * @param initialDelayMs    wait before the second attempt
 * @param backoffMultiplier growth factor applied to each further wait
 * @param ignoredExceptions failures that are rethrown at once, never retried
 */
public record RetryOptions(
        int maxAttempts,
        long initialDelayMs,
        double backoffMultiplier,
        List<Class<? extends Throwable>> ignoredExceptions) {

    public static final double DEFAULT_MULTIPLIER = 2.0;

    public RetryOptions {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1, got: " + maxAttempts);
        }
        if (initialDelayMs < 0) {
            throw new IllegalArgumentException("initialDelayMs must be >= 0, got: " + initialDelayMs);
        }
        if (backoffMultiplier < 1.0) {
            throw new IllegalArgumentException("backoffMultiplier must be >= 1.0, got: " + backoffMultiplier);
        }
        ignoredExceptions = ignoredExceptions != null ? List.copyOf(ignoredExceptions) : List.of();
    }

    public static RetryOptions of(int maxAttempts, long initialDelayMs) {
        return new RetryOptions(maxAttempts, initialDelayMs, DEFAULT_MULTIPLIER, List.of());
    }

    public RetryOptions ignoring(List<Class<? extends Throwable>> exceptions) {
        return new RetryOptions(maxAttempts, initialDelayMs, backoffMultiplier, exceptions);
    }
}
