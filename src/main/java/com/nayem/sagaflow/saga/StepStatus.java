package com.nayem.sagaflow.saga;

import java.util.Locale;

/**
 * Status of a single step as recorded in the saga history.
 */
public enum StepStatus {
    PENDING,
    RUNNING,
    COMPLETED,
    FAILED,
    COMPENSATING,
    COMPENSATED;

    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static StepStatus fromValue(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("step status must not be blank");
        }
        return StepStatus.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
