package com.nayem.sagaflow.events;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Event published on the {@link EventBus} and appended to the event store.
 *
 * @param eventId       Unique id of this event
 * @param eventType     Contract name, see {@link SagaEventTypes}
 * @param aggregateId   Saga id (stream id in the event store)
 * @param correlationId Correlation id propagated from the saga context
 * @param occurredAt    When the event was created
 * @param metadata      Event-specific fields
 */
public record DomainEvent(
        String eventId,
        String eventType,
        String aggregateId,
        String correlationId,
        Instant occurredAt,
        Map<String, Object> metadata) {

    public DomainEvent {
        metadata = metadata == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    public static DomainEvent of(String eventType, String aggregateId, String correlationId,
            Map<String, Object> metadata) {
        return new DomainEvent(UUID.randomUUID().toString(), eventType, aggregateId, correlationId,
                Instant.now(), metadata);
    }

    public DomainEvent withCorrelationId(String newCorrelationId) {
        return new DomainEvent(eventId, eventType, aggregateId, newCorrelationId, occurredAt, metadata);
    }

    public Object get(String key) {
        return metadata.get(key);
    }

    public String getString(String key) {
        Object value = metadata.get(key);
        return value == null ? null : value.toString();
    }

    /**
     * Reads an integral metadata value that may have been widened or narrowed by JSON.
     */
    public long getLong(String key, long defaultValue) {
        Object value = metadata.get(key);
        if (value instanceof Number) {
            return ((Number) value).longValue();
        }
        if (value instanceof String) {
            try {
                return Long.parseLong((String) value);
            } catch (NumberFormatException e) {
                return defaultValue;
            }
        }
        return defaultValue;
    }
}
