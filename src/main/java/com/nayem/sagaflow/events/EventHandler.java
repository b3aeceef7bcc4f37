package com.nayem.sagaflow.events;

@FunctionalInterface
public interface EventHandler {

    void handle(DomainEvent event) throws Exception;
}
