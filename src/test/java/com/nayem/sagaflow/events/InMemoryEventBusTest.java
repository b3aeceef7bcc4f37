package com.nayem.sagaflow.events;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.junit.jupiter.api.Assertions.*;

class InMemoryEventBusTest {

    @Test
    void testDeliversToTypeAndWildcardSubscribers() {
        InMemoryEventBus bus = new InMemoryEventBus();
        List<String> received = new CopyOnWriteArrayList<>();
        bus.subscribe(SagaEventTypes.STEP_COMPLETED, event -> received.add("typed:" + event.eventType()));
        bus.subscribe(EventBus.ALL_EVENTS, event -> received.add("all:" + event.eventType()));

        bus.publish(DomainEvent.of(SagaEventTypes.STEP_COMPLETED, "saga-1", "corr-1", Map.of()));
        bus.publish(DomainEvent.of(SagaEventTypes.STEP_FAILED, "saga-1", "corr-1", Map.of()));

        assertEquals(List.of("typed:StepCompleted", "all:StepCompleted", "all:StepFailed"), received);
        assertEquals(1, bus.subscriberCount(SagaEventTypes.STEP_COMPLETED));
        assertEquals(0, bus.subscriberCount(SagaEventTypes.SAGA_STARTED));
    }

    @Test
    void testFailingHandlerDoesNotStopOthers() {
        InMemoryEventBus bus = new InMemoryEventBus();
        List<String> received = new CopyOnWriteArrayList<>();
        bus.subscribe("OrderPlaced", event -> {
            throw new IllegalStateException("first handler down");
        });
        bus.subscribe("OrderPlaced", event -> received.add("second"));
        bus.subscribe("OrderPlaced", event -> {
            throw new IllegalStateException("third handler down");
        });

        EventPublishException error = assertThrows(EventPublishException.class,
                () -> bus.publish(DomainEvent.of("OrderPlaced", "o-1", null, Map.of())));

        assertEquals(List.of("second"), received);
        assertTrue(error.getMessage().contains("first handler down"));
        assertEquals(1, error.getSuppressed().length);
    }

    @Test
    void testPublishWithoutSubscribersIsNoOp() {
        assertDoesNotThrow(() -> new InMemoryEventBus().publish(DomainEvent.of("Nobody", "x", null, null)));
    }

    @Test
    void testDomainEventMetadataIsImmutable() {
        DomainEvent event = DomainEvent.of("OrderPlaced", "o-1", null, Map.of("count", "7"));

        assertThrows(UnsupportedOperationException.class, () -> event.metadata().put("x", 1));
        assertEquals(7, event.getLong("count", 0));
        assertEquals(-1, event.getLong("missing", -1));
        assertEquals("c-1", event.withCorrelationId("c-1").correlationId());
    }
}
