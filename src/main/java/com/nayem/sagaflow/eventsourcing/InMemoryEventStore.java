package com.nayem.sagaflow.eventsourcing;

import com.nayem.sagaflow.events.DomainEvent;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * In-memory implementation of {@link EventStore}.
 * <p>
 * Suitable for tests and single-instance development setups. Events are lost on restart.
 * </p>
 */
public class InMemoryEventStore implements EventStore {

    public static final int DEFAULT_MAX_EVENTS_PER_STREAM = 10_000;

    private final ReadWriteLock lock = new ReentrantReadWriteLock();
    private final Map<String, List<StoredEvent>> streams = new HashMap<>();
    private final List<StoredEvent> allEvents = new ArrayList<>();
    private final int maxEventsPerStream;
    private long position;

    public InMemoryEventStore() {
        this(DEFAULT_MAX_EVENTS_PER_STREAM);
    }

    /**
     * @param maxEventsPerStream Upper bound per stream, {@code 0} for unlimited
     */
    public InMemoryEventStore(int maxEventsPerStream) {
        if (maxEventsPerStream < 0) {
            throw new IllegalArgumentException("maxEventsPerStream must be >= 0");
        }
        this.maxEventsPerStream = maxEventsPerStream;
    }

    @Override
    public void appendEvents(String aggregateId, long expectedVersion, List<DomainEvent> events) {
        lock.writeLock().lock();
        try {
            List<StoredEvent> stream = streams.getOrDefault(aggregateId, List.of());
            long currentVersion = stream.isEmpty() ? 0 : stream.get(stream.size() - 1).version();
            if (expectedVersion != currentVersion) {
                throw new ConcurrencyConflictException(aggregateId, expectedVersion, currentVersion);
            }
            if (events.isEmpty()) {
                return;
            }
            int newCount = stream.size() + events.size();
            if (maxEventsPerStream > 0 && newCount > maxEventsPerStream) {
                throw new EventStoreException("max events per stream exceeded for " + aggregateId + ": "
                        + newCount + " (limit: " + maxEventsPerStream + ")");
            }

            List<StoredEvent> updated = new ArrayList<>(stream);
            long version = currentVersion;
            for (DomainEvent event : events) {
                StoredEvent stored = new StoredEvent(
                        event.eventId(),
                        aggregateId,
                        event.eventType(),
                        event.correlationId(),
                        event.metadata(),
                        ++version,
                        ++position,
                        event.occurredAt());
                updated.add(stored);
                allEvents.add(stored);
            }
            streams.put(aggregateId, updated);
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public List<StoredEvent> getEvents(String aggregateId, long fromVersion) {
        lock.readLock().lock();
        try {
            List<StoredEvent> result = new ArrayList<>();
            for (StoredEvent event : streams.getOrDefault(aggregateId, List.of())) {
                if (event.version() >= fromVersion) {
                    result.add(event);
                }
            }
            return result;
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public List<StoredEvent> getEventsByType(String eventType, Instant since) {
        lock.readLock().lock();
        try {
            List<StoredEvent> result = new ArrayList<>();
            for (StoredEvent event : allEvents) {
                if (event.eventType().equals(eventType) && event.occurredAt().isAfter(since)) {
                    result.add(event);
                }
            }
            return result;
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public List<StoredEvent> getAllEvents(long fromPosition) {
        lock.readLock().lock();
        try {
            List<StoredEvent> result = new ArrayList<>();
            for (StoredEvent event : allEvents) {
                if (event.position() >= fromPosition) {
                    result.add(event);
                }
            }
            return result;
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Drops every stream. Useful for testing.
     */
    public void clear() {
        lock.writeLock().lock();
        try {
            streams.clear();
            allEvents.clear();
            position = 0;
        } finally {
            lock.writeLock().unlock();
        }
    }
}
