package com.nayem.sagaflow.events;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Synchronous in-process event bus.
 * <p>
 * Every handler is invoked even when an earlier one fails; the failures are then
 * raised together as an {@link EventPublishException}.
 * </p>
 */
public class InMemoryEventBus implements EventBus {

    private static final Logger log = LoggerFactory.getLogger(InMemoryEventBus.class);

    private final Map<String, List<EventHandler>> handlers = new ConcurrentHashMap<>();

    @Override
    public void publish(DomainEvent event) {
        List<EventHandler> targets = new ArrayList<>(handlers.getOrDefault(event.eventType(), List.of()));
        targets.addAll(handlers.getOrDefault(ALL_EVENTS, List.of()));

        EventPublishException failure = null;
        for (EventHandler handler : targets) {
            try {
                handler.handle(event);
            } catch (Exception e) {
                log.debug("Handler failed for {} of saga {}", event.eventType(), event.aggregateId(), e);
                if (failure == null) {
                    failure = new EventPublishException(
                            "handler failed for event " + event.eventType() + ": " + e.getMessage(), e);
                } else {
                    failure.addSuppressed(e);
                }
            }
        }
        if (failure != null) {
            throw failure;
        }
    }

    @Override
    public void subscribe(String eventType, EventHandler handler) {
        handlers.computeIfAbsent(eventType, k -> new CopyOnWriteArrayList<>()).add(handler);
    }

    public int subscriberCount(String eventType) {
        return handlers.getOrDefault(eventType, List.of()).size();
    }
}
