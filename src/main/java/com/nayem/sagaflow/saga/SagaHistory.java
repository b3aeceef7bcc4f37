package com.nayem.sagaflow.saga;

import java.time.Duration;
import java.time.Instant;

/**
 * One entry of a saga's execution history.
 * <p>
 * Entries are identified by {@code (stepName, startedAt)}; updates replace the
 * entry with the same key so replaying them is idempotent. {@link SagaInstance} starts
 * every entry strictly after the previous one, so the key holds even when the clock
 * does not advance between a step and its compensation. Entries written by other
 * means must keep that ordering themselves.
 * </p>
 *
 * @param stepName     Name of the step this entry belongs to
 * @param status       Step status at the time of recording
 * @param startedAt    When the step (or its compensation) started
 * @param completedAt  When it finished, {@code null} while in flight
 * @param error        Error message for failed entries
 * @param retryAttempt Zero-based index of the last attempt
 */
public record SagaHistory(
        String stepName,
        StepStatus status,
        Instant startedAt,
        Instant completedAt,
        String error,
        int retryAttempt) {

    public static SagaHistory running(String stepName, Instant startedAt) {
        return new SagaHistory(stepName, StepStatus.RUNNING, startedAt, null, null, 0);
    }

    public static SagaHistory compensating(String stepName, Instant startedAt) {
        return new SagaHistory(stepName, StepStatus.COMPENSATING, startedAt, null, null, 0);
    }

    public SagaHistory completed(Instant at, int attempt) {
        return new SagaHistory(stepName, StepStatus.COMPLETED, startedAt, at, null, attempt);
    }

    public SagaHistory failed(Instant at, String reason, int attempt) {
        return new SagaHistory(stepName, StepStatus.FAILED, startedAt, at, reason, attempt);
    }

    public SagaHistory compensated(Instant at) {
        return new SagaHistory(stepName, StepStatus.COMPENSATED, startedAt, at, null, retryAttempt);
    }

    public boolean sameEntry(SagaHistory other) {
        return stepName.equals(other.stepName) && startedAt.equals(other.startedAt);
    }

    /**
     * @return elapsed time, or {@link Duration#ZERO} while in flight
     */
    public Duration duration() {
        if (completedAt == null) {
            return Duration.ZERO;
        }
        return Duration.between(startedAt, completedAt);
    }
}
