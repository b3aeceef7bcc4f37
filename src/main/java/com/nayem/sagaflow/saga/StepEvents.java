package com.nayem.sagaflow.saga;

import com.nayem.sagaflow.events.SagaEventTypes;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Mapping between history entries and the {@code Step*} events carrying them.
 */
public final class StepEvents {

    private StepEvents() {
    }

    public static String eventTypeFor(StepStatus status) {
        return switch (status) {
            case COMPLETED -> SagaEventTypes.STEP_COMPLETED;
            case FAILED -> SagaEventTypes.STEP_FAILED;
            case COMPENSATING -> SagaEventTypes.STEP_COMPENSATING;
            case COMPENSATED -> SagaEventTypes.STEP_COMPENSATED;
            case PENDING, RUNNING -> SagaEventTypes.STEP_STARTED;
        };
    }

    public static StepStatus statusFor(String eventType) {
        return switch (eventType) {
            case SagaEventTypes.STEP_STARTED -> StepStatus.RUNNING;
            case SagaEventTypes.STEP_COMPLETED -> StepStatus.COMPLETED;
            case SagaEventTypes.STEP_FAILED -> StepStatus.FAILED;
            case SagaEventTypes.STEP_COMPENSATING -> StepStatus.COMPENSATING;
            case SagaEventTypes.STEP_COMPENSATED -> StepStatus.COMPENSATED;
            default -> throw new IllegalArgumentException("not a step event: " + eventType);
        };
    }

    public static Map<String, Object> toMetadata(SagaHistory entry) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put(SagaEventTypes.STEP_NAME, entry.stepName());
        metadata.put(SagaEventTypes.STARTED_AT, entry.startedAt().toString());
        if (entry.completedAt() != null) {
            metadata.put(SagaEventTypes.COMPLETED_AT, entry.completedAt().toString());
            metadata.put(SagaEventTypes.DURATION_MS, entry.duration().toMillis());
        }
        StepStatus status = entry.status();
        if (status != StepStatus.COMPENSATING && status != StepStatus.COMPENSATED) {
            metadata.put(SagaEventTypes.RETRY_ATTEMPT, entry.retryAttempt());
        }
        if (entry.error() != null) {
            metadata.put(SagaEventTypes.ERROR, entry.error());
            metadata.put(SagaEventTypes.ERROR_MESSAGE, entry.error());
        }
        return metadata;
    }

    public static SagaHistory fromMetadata(String eventType, Map<String, Object> metadata) {
        Object stepName = metadata.get(SagaEventTypes.STEP_NAME);
        Object startedAt = metadata.get(SagaEventTypes.STARTED_AT);
        if (stepName == null || startedAt == null) {
            throw new IllegalArgumentException(eventType + " event is missing step_name or started_at");
        }
        Object completedAt = metadata.get(SagaEventTypes.COMPLETED_AT);
        Object error = metadata.containsKey(SagaEventTypes.ERROR_MESSAGE)
                ? metadata.get(SagaEventTypes.ERROR_MESSAGE)
                : metadata.get(SagaEventTypes.ERROR);
        Object attempt = metadata.get(SagaEventTypes.RETRY_ATTEMPT);
        return new SagaHistory(
                stepName.toString(),
                statusFor(eventType),
                Instant.parse(startedAt.toString()),
                completedAt == null ? null : Instant.parse(completedAt.toString()),
                error == null ? null : error.toString(),
                attempt instanceof Number ? ((Number) attempt).intValue() : 0);
    }
}
