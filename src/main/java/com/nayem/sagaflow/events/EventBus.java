package com.nayem.sagaflow.events;

/**
 * Publishes saga lifecycle events to interested subscribers.
 */
public interface EventBus {

    /** Subscribes to every event type. */
    String ALL_EVENTS = "*";

    /**
     * @throws EventPublishException when delivery fails
     */
    void publish(DomainEvent event);

    void subscribe(String eventType, EventHandler handler);
}
