package com.nayem.sagaflow.eventsourcing;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Serialized aggregate state at a stream version, plus free-form bookkeeping metadata.
 *
 * @param aggregateId   Stream the snapshot belongs to
 * @param aggregateType Kind of aggregate, e.g. {@code saga}
 * @param version       Stream version the state reflects
 * @param state         Serialized state, empty when only the metadata is tracked
 * @param metadata      Bookkeeping values
 * @param createdAt     When the snapshot was taken
 */
public record Snapshot(
        String aggregateId,
        String aggregateType,
        long version,
        byte[] state,
        Map<String, Object> metadata,
        Instant createdAt) {

    public Snapshot {
        state = state == null ? new byte[0] : state;
        metadata = metadata == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    public boolean hasState() {
        return state.length > 0;
    }

    public long getLong(String key, long defaultValue) {
        Object value = metadata.get(key);
        return value instanceof Number ? ((Number) value).longValue() : defaultValue;
    }
}
