package com.nayem.sagaflow.eventsourcing;

import com.nayem.sagaflow.events.DomainEvent;

import java.time.Instant;
import java.util.List;

/**
 * Append-only storage of event streams with optimistic concurrency.
 */
public interface EventStore {

    /**
     * Appends {@code events} to the stream of {@code aggregateId}. The first event gets
     * version {@code expectedVersion + 1}.
     *
     * @param expectedVersion Version the stream must currently have, 0 for a new stream
     * @throws ConcurrencyConflictException when the stream is at another version
     * @throws EventStoreException          when the events cannot be stored
     */
    void appendEvents(String aggregateId, long expectedVersion, List<DomainEvent> events);

    /**
     * @return events with {@code version >= fromVersion} in version order; empty for an unknown stream
     */
    List<StoredEvent> getEvents(String aggregateId, long fromVersion);

    /**
     * @return events of {@code eventType} across all streams that occurred after {@code since},
     *         in position order
     */
    List<StoredEvent> getEventsByType(String eventType, Instant since);

    /**
     * @return every event with {@code position >= fromPosition}, in position order
     */
    List<StoredEvent> getAllEvents(long fromPosition);
}
