package com.nayem.sagaflow.saga;

import java.time.Duration;
import java.util.Set;

/**
 * Retry decisions for a saga step.
 * <p>
 * The back-off is linear-weighted: {@code initialDelay * (attempt + 1) * backoffMultiplier}.
 * When {@code retryableErrors} is non-empty only errors of those types (or errors
 * caused by them) are retried.
 * </p>
 *
 * @param maxAttempts       Total attempts including the first one
 * @param initialDelay      Base delay between attempts
 * @param backoffMultiplier Multiplier applied to the weighted delay
 * @param retryableErrors   Optional allow-list of retryable exception types
 */
public record RetryPolicy(
        int maxAttempts,
        Duration initialDelay,
        double backoffMultiplier,
        Set<Class<? extends Throwable>> retryableErrors) {

    public RetryPolicy {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1, got " + maxAttempts);
        }
        if (initialDelay == null || initialDelay.isNegative()) {
            throw new IllegalArgumentException("initialDelay must be zero or positive");
        }
        if (backoffMultiplier < 0) {
            throw new IllegalArgumentException("backoffMultiplier must not be negative");
        }
        retryableErrors = retryableErrors == null ? Set.of() : Set.copyOf(retryableErrors);
    }

    public static RetryPolicy noRetry() {
        return new RetryPolicy(1, Duration.ZERO, 1.0, Set.of());
    }

    public static RetryPolicy simple(int maxAttempts) {
        return new RetryPolicy(maxAttempts, Duration.ofSeconds(1), 1.0, Set.of());
    }

    public static RetryPolicy exponentialBackoff(int maxAttempts, Duration initialDelay, double backoffMultiplier) {
        return new RetryPolicy(maxAttempts, initialDelay, backoffMultiplier, Set.of());
    }

    @SafeVarargs
    public final RetryPolicy retryOn(Class<? extends Throwable>... errorTypes) {
        return new RetryPolicy(maxAttempts, initialDelay, backoffMultiplier, Set.of(errorTypes));
    }

    public boolean shouldRetry(Throwable error, int attempt) {
        if (attempt >= maxAttempts) {
            return false;
        }
        if (retryableErrors.isEmpty()) {
            return true;
        }
        for (Throwable current = error; current != null; current = current.getCause()) {
            for (Class<? extends Throwable> type : retryableErrors) {
                if (type.isInstance(current)) {
                    return true;
                }
            }
            if (current.getCause() == current) {
                break;
            }
        }
        return false;
    }

    public Duration calculateDelay(int attempt) {
        double nanos = initialDelay.toNanos() * (attempt + 1) * backoffMultiplier;
        return Duration.ofNanos((long) nanos);
    }
}
