package com.nayem.sagaflow.saga;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;

/**
 * Immutable snapshot of a {@link SagaContext}'s metadata.
 *
 * @param timeout       Saga-wide deadline, {@link Duration#ZERO} when unset
 * @param retryPolicy   Saga-wide retry policy, {@code null} when unset
 * @param correlationId Correlation id propagated to events and commands
 * @param createdAt     When the context was created
 * @param updatedAt     Last modification of the metadata
 * @param custom        Caller-defined values
 */
public record SagaMetadata(
        Duration timeout,
        RetryPolicy retryPolicy,
        String correlationId,
        Instant createdAt,
        Instant updatedAt,
        Map<String, ContextValue> custom) {

    public SagaMetadata {
        timeout = timeout == null ? Duration.ZERO : timeout;
        custom = custom == null ? Map.of() : Map.copyOf(custom);
    }
}
