package com.nayem.sagaflow.eventsourcing;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.util.Optional;

/**
 * Redis-backed implementation of {@link SnapshotStore}; one JSON value per aggregate.
 */
public class RedisSnapshotStore implements SnapshotStore {

    private static final String KEY_PREFIX = "sagaflow:es:snapshot:";

    private final StringRedisTemplate redisTemplate;
    private final ObjectMapper objectMapper;

    public RedisSnapshotStore(StringRedisTemplate redisTemplate, ObjectMapper objectMapper) {
        this.redisTemplate = redisTemplate;
        this.objectMapper = EventJson.configure(objectMapper);
    }

    @Override
    public void saveSnapshot(Snapshot snapshot) {
        String json;
        try {
            json = objectMapper.writeValueAsString(snapshot);
        } catch (JsonProcessingException e) {
            throw new EventStoreException("failed to serialize snapshot of " + snapshot.aggregateId(), e);
        }
        try {
            redisTemplate.opsForValue().set(KEY_PREFIX + snapshot.aggregateId(), json);
        } catch (DataAccessException e) {
            throw new EventStoreException("failed to save snapshot of " + snapshot.aggregateId(), e);
        }
    }

    @Override
    public Optional<Snapshot> getSnapshot(String aggregateId) {
        String json;
        try {
            json = redisTemplate.opsForValue().get(KEY_PREFIX + aggregateId);
        } catch (DataAccessException e) {
            throw new EventStoreException("failed to read snapshot of " + aggregateId, e);
        }
        if (json == null) {
            return Optional.empty();
        }
        try {
            return Optional.of(objectMapper.readValue(json, Snapshot.class));
        } catch (JsonProcessingException e) {
            throw new EventStoreException("failed to deserialize snapshot of " + aggregateId, e);
        }
    }

    @Override
    public void deleteSnapshots(String aggregateId, long beforeVersion) {
        getSnapshot(aggregateId)
                .filter(snapshot -> snapshot.version() < beforeVersion)
                .ifPresent(snapshot -> redisTemplate.delete(KEY_PREFIX + aggregateId));
    }
}
