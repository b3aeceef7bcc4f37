package com.nayem.sagaflow.saga;

import com.nayem.sagaflow.events.DomainEvent;
import com.nayem.sagaflow.events.EventBus;

import java.time.Duration;
import java.util.function.Function;

/**
 * Step that publishes an event, and optionally a compensating event on rollback.
 * Events are stamped with the saga correlation id when they carry none.
 */
public class EventSagaStep implements SagaStep {

    private final String name;
    private final EventBus eventBus;
    private final Function<SagaContext, DomainEvent> event;
    private final Function<SagaContext, DomainEvent> compensationEvent;
    private final StepOptions options;

    public EventSagaStep(String name, EventBus eventBus,
            Function<SagaContext, DomainEvent> event,
            Function<SagaContext, DomainEvent> compensationEvent) {
        this(name, eventBus, event, compensationEvent, StepOptions.defaults());
    }

    public EventSagaStep(String name, EventBus eventBus,
            Function<SagaContext, DomainEvent> event,
            Function<SagaContext, DomainEvent> compensationEvent,
            StepOptions options) {
        if (name == null || name.isBlank()) {
            throw new IllegalStateException("step name is required");
        }
        if (eventBus == null || event == null) {
            throw new IllegalStateException("event bus and event are required for step " + name);
        }
        this.name = name;
        this.eventBus = eventBus;
        this.event = event;
        this.compensationEvent = compensationEvent;
        this.options = options == null ? StepOptions.defaults() : options;
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public void execute(SagaContext context) {
        eventBus.publish(stamp(event.apply(context), context));
    }

    @Override
    public void compensate(SagaContext context) {
        if (compensationEvent == null) {
            return;
        }
        DomainEvent compensating = compensationEvent.apply(context);
        if (compensating != null) {
            eventBus.publish(stamp(compensating, context));
        }
    }

    private DomainEvent stamp(DomainEvent domainEvent, SagaContext context) {
        if (domainEvent.correlationId() == null && context.getCorrelationId() != null) {
            return domainEvent.withCorrelationId(context.getCorrelationId());
        }
        return domainEvent;
    }

    @Override
    public boolean canExecute(SagaContext context) {
        return options.allows(context);
    }

    @Override
    public Duration getTimeout() {
        return options.timeout();
    }

    @Override
    public RetryPolicy getRetryPolicy() {
        return options.retryPolicy();
    }
}
