package com.nayem.sagaflow.eventsourcing;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.nayem.sagaflow.events.DomainEvent;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.RedisScript;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Redis-backed implementation of {@link EventStore}.
 * <p>
 * Each stream is a Redis list whose length is the stream version. A Lua script checks the
 * expected version and appends in one atomic step, also copying every event to a per-type
 * list and to a store-wide list. Events are stored as JSON.
 * </p>
 */
public class RedisEventStore implements EventStore {

    private static final String KEY_PREFIX = "sagaflow:es:";
    private static final String POSITION_KEY = KEY_PREFIX + "position";
    private static final String ALL_EVENTS_KEY = KEY_PREFIX + "all";

    // KEYS: stream, position counter, all-events list, then one type list per event.
    // ARGV: expected version, then one JSON object per event.
    private static final RedisScript<Long> APPEND_SCRIPT = RedisScript.of("""
            local current = redis.call('LLEN', KEYS[1])
            if current ~= tonumber(ARGV[1]) then
                return -(current + 1)
            end
            local count = #ARGV - 1
            for i = 1, count do
                local position = redis.call('INCR', KEYS[2])
                local stored = '{"version":' .. (current + i) .. ',"position":' .. position .. ','
                        .. string.sub(ARGV[i + 1], 2)
                redis.call('RPUSH', KEYS[1], stored)
                redis.call('RPUSH', KEYS[3], stored)
                redis.call('RPUSH', KEYS[i + 3], stored)
            end
            return current + count
            """, Long.class);

    private final StringRedisTemplate redisTemplate;
    private final ObjectMapper objectMapper;

    public RedisEventStore(StringRedisTemplate redisTemplate, ObjectMapper objectMapper) {
        this.redisTemplate = redisTemplate;
        this.objectMapper = EventJson.configure(objectMapper);
    }

    static String streamKey(String aggregateId) {
        return KEY_PREFIX + "stream:" + aggregateId;
    }

    static String typeKey(String eventType) {
        return KEY_PREFIX + "type:" + eventType;
    }

    @Override
    public void appendEvents(String aggregateId, long expectedVersion, List<DomainEvent> events) {
        List<String> keys = new ArrayList<>();
        keys.add(streamKey(aggregateId));
        keys.add(POSITION_KEY);
        keys.add(ALL_EVENTS_KEY);
        List<String> args = new ArrayList<>();
        args.add(Long.toString(expectedVersion));
        for (DomainEvent event : events) {
            keys.add(typeKey(event.eventType()));
            args.add(serialize(aggregateId, event));
        }

        Long result;
        try {
            result = redisTemplate.execute(APPEND_SCRIPT, keys, args.toArray());
        } catch (DataAccessException e) {
            throw new EventStoreException("failed to append events to stream " + aggregateId, e);
        }
        if (result == null) {
            throw new EventStoreException("no reply appending events to stream " + aggregateId);
        }
        if (result < 0) {
            throw new ConcurrencyConflictException(aggregateId, expectedVersion, -result - 1);
        }
    }

    @Override
    public List<StoredEvent> getEvents(String aggregateId, long fromVersion) {
        long start = Math.max(fromVersion - 1, 0);
        return read(streamKey(aggregateId), start);
    }

    @Override
    public List<StoredEvent> getEventsByType(String eventType, Instant since) {
        List<StoredEvent> result = new ArrayList<>();
        for (StoredEvent event : read(typeKey(eventType), 0)) {
            if (event.occurredAt().isAfter(since)) {
                result.add(event);
            }
        }
        return result;
    }

    @Override
    public List<StoredEvent> getAllEvents(long fromPosition) {
        List<StoredEvent> result = new ArrayList<>();
        for (StoredEvent event : read(ALL_EVENTS_KEY, 0)) {
            if (event.position() >= fromPosition) {
                result.add(event);
            }
        }
        return result;
    }

    private List<StoredEvent> read(String key, long start) {
        List<String> jsons;
        try {
            jsons = redisTemplate.opsForList().range(key, start, -1);
        } catch (DataAccessException e) {
            throw new EventStoreException("failed to read " + key, e);
        }
        if (jsons == null || jsons.isEmpty()) {
            return List.of();
        }
        List<StoredEvent> events = new ArrayList<>(jsons.size());
        for (String json : jsons) {
            try {
                events.add(objectMapper.readValue(json, StoredEvent.class));
            } catch (JsonProcessingException e) {
                throw new EventStoreException("failed to deserialize event from " + key, e);
            }
        }
        return events;
    }

    private String serialize(String aggregateId, DomainEvent event) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("eventId", event.eventId());
        body.put("aggregateId", aggregateId);
        body.put("eventType", event.eventType());
        body.put("correlationId", event.correlationId());
        body.put("metadata", event.metadata());
        body.put("occurredAt", event.occurredAt());
        try {
            return objectMapper.writeValueAsString(body);
        } catch (JsonProcessingException e) {
            throw new EventStoreException("failed to serialize " + event.eventType() + " for " + aggregateId, e);
        }
    }
}
