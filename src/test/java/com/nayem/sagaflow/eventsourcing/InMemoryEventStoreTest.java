package com.nayem.sagaflow.eventsourcing;

import com.nayem.sagaflow.events.DomainEvent;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class InMemoryEventStoreTest {

    private static final Instant T0 = Instant.parse("2024-05-01T08:00:00Z");

    @Test
    void testAppendAssignsVersionsAndPositions() {
        InMemoryEventStore store = new InMemoryEventStore();

        store.appendEvents("saga-1", 0, List.of(event("SagaStarted", "saga-1", T0), event("StepStarted", "saga-1", T0)));
        store.appendEvents("saga-2", 0, List.of(event("SagaStarted", "saga-2", T0)));
        store.appendEvents("saga-1", 2, List.of(event("StepCompleted", "saga-1", T0)));

        List<StoredEvent> stream = store.getEvents("saga-1", 1);
        assertEquals(List.of(1L, 2L, 3L), stream.stream().map(StoredEvent::version).toList());
        assertEquals(List.of(1L, 2L, 4L), stream.stream().map(StoredEvent::position).toList());
        assertEquals("StepCompleted", stream.get(2).eventType());
        assertEquals(3, store.getEvents("saga-2", 1).get(0).position());
    }

    @Test
    void testGetEventsFromVersion() {
        InMemoryEventStore store = new InMemoryEventStore();
        store.appendEvents("saga-1", 0, List.of(
                event("A", "saga-1", T0), event("B", "saga-1", T0), event("C", "saga-1", T0)));

        assertEquals(List.of("B", "C"), store.getEvents("saga-1", 2).stream().map(StoredEvent::eventType).toList());
        assertTrue(store.getEvents("saga-1", 4).isEmpty());
        assertTrue(store.getEvents("unknown", 1).isEmpty());
    }

    @Test
    void testStaleExpectedVersionConflicts() {
        InMemoryEventStore store = new InMemoryEventStore();
        store.appendEvents("saga-1", 0, List.of(event("A", "saga-1", T0)));

        ConcurrencyConflictException conflict = assertThrows(ConcurrencyConflictException.class,
                () -> store.appendEvents("saga-1", 0, List.of(event("B", "saga-1", T0))));

        assertEquals("saga-1", conflict.getAggregateId());
        assertEquals(0, conflict.getExpectedVersion());
        assertEquals(1, conflict.getActualVersion());
        assertEquals(1, store.getEvents("saga-1", 1).size());
    }

    @Test
    void testEmptyAppendStillChecksVersion() {
        InMemoryEventStore store = new InMemoryEventStore();

        store.appendEvents("saga-1", 0, List.of());

        assertTrue(store.getEvents("saga-1", 1).isEmpty());
        assertThrows(ConcurrencyConflictException.class, () -> store.appendEvents("saga-1", 3, List.of()));
    }

    @Test
    void testStreamLimit() {
        InMemoryEventStore store = new InMemoryEventStore(2);
        store.appendEvents("saga-1", 0, List.of(event("A", "saga-1", T0), event("B", "saga-1", T0)));

        EventStoreException error = assertThrows(EventStoreException.class,
                () -> store.appendEvents("saga-1", 2, List.of(event("C", "saga-1", T0))));

        assertEquals("max events per stream exceeded for saga-1: 3 (limit: 2)", error.getMessage());
        assertEquals(2, store.getEvents("saga-1", 1).size());
        assertThrows(IllegalArgumentException.class, () -> new InMemoryEventStore(-1));
    }

    @Test
    void testUnlimitedStream() {
        InMemoryEventStore store = new InMemoryEventStore(0);
        for (int i = 0; i < 50; i++) {
            store.appendEvents("saga-1", i, List.of(event("A", "saga-1", T0)));
        }
        assertEquals(50, store.getEvents("saga-1", 1).size());
    }

    @Test
    void testEventsByTypeAfterInstant() {
        InMemoryEventStore store = new InMemoryEventStore();
        store.appendEvents("saga-1", 0, List.of(
                event("SagaStarted", "saga-1", T0),
                event("StepStarted", "saga-1", T0.plusSeconds(1))));
        store.appendEvents("saga-2", 0, List.of(event("SagaStarted", "saga-2", T0.plusSeconds(2))));

        List<StoredEvent> all = store.getEventsByType("SagaStarted", Instant.EPOCH);
        List<StoredEvent> later = store.getEventsByType("SagaStarted", T0);

        assertEquals(List.of("saga-1", "saga-2"), all.stream().map(StoredEvent::aggregateId).toList());
        assertEquals(List.of("saga-2"), later.stream().map(StoredEvent::aggregateId).toList());
        assertTrue(store.getEventsByType("SagaFailed", Instant.EPOCH).isEmpty());
    }

    @Test
    void testAllEventsFromPosition() {
        InMemoryEventStore store = new InMemoryEventStore();
        store.appendEvents("saga-1", 0, List.of(event("A", "saga-1", T0)));
        store.appendEvents("saga-2", 0, List.of(event("B", "saga-2", T0)));
        store.appendEvents("saga-1", 1, List.of(event("C", "saga-1", T0)));

        assertEquals(List.of("B", "C"), store.getAllEvents(2).stream().map(StoredEvent::eventType).toList());
        assertEquals(3, store.getAllEvents(0).size());

        store.clear();
        assertTrue(store.getAllEvents(0).isEmpty());
        store.appendEvents("saga-3", 0, List.of(event("D", "saga-3", T0)));
        assertEquals(1, store.getAllEvents(0).get(0).position());
    }

    @Test
    void testStoredEventKeepsPayload() {
        InMemoryEventStore store = new InMemoryEventStore();
        DomainEvent event = new DomainEvent("evt-1", "StepFailed", "saga-1", "corr-1", T0,
                Map.of("step_name", "charge", "retry_attempt", 2));

        store.appendEvents("saga-1", 0, List.of(event));

        StoredEvent stored = store.getEvents("saga-1", 1).get(0);
        assertEquals("evt-1", stored.eventId());
        assertEquals("corr-1", stored.correlationId());
        assertEquals(T0, stored.occurredAt());
        assertEquals("charge", stored.getString("step_name"));
        assertEquals(2, stored.getLong("retry_attempt", 0));
    }

    static DomainEvent event(String type, String aggregateId, Instant occurredAt) {
        return new DomainEvent(UUID.randomUUID().toString(), type, aggregateId, null, occurredAt, Map.of());
    }
}
