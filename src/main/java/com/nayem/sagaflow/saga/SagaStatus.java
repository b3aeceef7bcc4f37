package com.nayem.sagaflow.saga;

import java.util.Locale;

/**
 * Represents the execution status of a Saga.
 */
public enum SagaStatus {

    /**
     * Saga created but not yet started.
     */
    PENDING,

    /**
     * Saga is currently executing forward steps.
     */
    RUNNING,

    /**
     * Saga completed successfully (all steps executed).
     */
    COMPLETED,

    /**
     * Saga is rolling back already completed steps.
     */
    COMPENSATING,

    /**
     * Every completed step was compensated.
     */
    COMPENSATED,

    /**
     * A compensation failed; manual intervention is needed.
     */
    FAILED;

    /**
     * Lowercase name used in persisted events and table rows.
     */
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    public boolean isTerminal() {
        return this == COMPLETED || this == COMPENSATED || this == FAILED;
    }

    public static SagaStatus fromValue(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("saga status must not be blank");
        }
        return SagaStatus.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
