package com.nayem.sagaflow.saga;

import java.time.Duration;

/**
 * Represents an individual step within a Saga transaction.
 * <p>
 * Each step has:
 * - A forward action (execute)
 * - A compensating action (compensate) invoked when a later step fails
 * - An optional guard, deadline and retry policy
 * </p>
 */
public interface SagaStep {

    /**
     * Unique name of this step within its definition.
     * Used as the history key and in state machine transitions.
     */
    String getName();

    /**
     * Execute the forward action. Implementations must be idempotent since resumed
     * sagas re-run every step.
     *
     * @param context the saga context shared by all steps
     * @throws Exception any failure; the engine retries it per the retry policy
     */
    void execute(SagaContext context) throws Exception;

    /**
     * Compensate/rollback this step after a later step failed.
     *
     * @param context the saga context shared by all steps
     */
    default void compensate(SagaContext context) throws Exception {
    }

    /**
     * Guard evaluated before the first attempt. Returning {@code false} fails the
     * saga without running the step.
     */
    default boolean canExecute(SagaContext context) {
        return true;
    }

    /**
     * Deadline for a single attempt.
     *
     * @return the timeout, {@link Duration#ZERO} for none
     */
    default Duration getTimeout() {
        return Duration.ZERO;
    }

    /**
     * @return the step's own retry policy, or {@code null} to inherit the saga-wide one
     */
    default RetryPolicy getRetryPolicy() {
        return null;
    }
}
