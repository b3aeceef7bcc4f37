package com.nayem.sagaflow.eventsourcing;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * An event as persisted in an {@link EventStore}.
 *
 * @param eventId       Id of the appended event
 * @param aggregateId   Stream the event belongs to
 * @param eventType     Event type name
 * @param correlationId Correlation id of the originating saga, may be {@code null}
 * @param metadata      Event payload
 * @param version       1-based position inside the stream
 * @param position      Store-wide position, increases across all streams
 * @param occurredAt    When the event was created
 */
public record StoredEvent(
        String eventId,
        String aggregateId,
        String eventType,
        String correlationId,
        Map<String, Object> metadata,
        long version,
        long position,
        Instant occurredAt) {

    public StoredEvent {
        metadata = metadata == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    public Object get(String key) {
        return metadata.get(key);
    }

    public String getString(String key) {
        Object value = metadata.get(key);
        return value == null ? null : value.toString();
    }

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
