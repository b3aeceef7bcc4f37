package com.nayem.sagaflow.saga;

import java.time.Duration;

/**
 * Timeout, retry policy and guard shared by every step variant.
 *
 * @param timeout     Per-attempt deadline, {@link Duration#ZERO} for none
 * @param retryPolicy Step-specific retry policy, {@code null} to inherit
 * @param guard       Guard evaluated before execution, {@code null} for always
 */
public record StepOptions(Duration timeout, RetryPolicy retryPolicy, StepGuard guard) {

    public StepOptions {
        timeout = timeout == null ? Duration.ZERO : timeout;
        if (timeout.isNegative()) {
            throw new IllegalArgumentException("timeout must not be negative");
        }
    }

    public static StepOptions defaults() {
        return new StepOptions(Duration.ZERO, null, null);
    }

    public StepOptions withTimeout(Duration newTimeout) {
        return new StepOptions(newTimeout, retryPolicy, guard);
    }

    public StepOptions withRetryPolicy(RetryPolicy newPolicy) {
        return new StepOptions(timeout, newPolicy, guard);
    }

    public StepOptions withGuard(StepGuard newGuard) {
        return new StepOptions(timeout, retryPolicy, newGuard);
    }

    public boolean allows(SagaContext context) {
        return guard == null || guard.test(context);
    }
}
