package com.nayem.sagaflow.saga;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Immutable, reusable description of a saga: ordered steps plus their compiled state machine.
 * Build it with {@link SagaBuilder}.
 */
public final class SagaDefinition {

    private final String name;
    private final List<SagaStep> steps;
    private final SagaStateMachine stateMachine;
    private final Duration defaultTimeout;
    private final RetryPolicy defaultRetryPolicy;

    SagaDefinition(String name, List<SagaStep> steps, Duration defaultTimeout, RetryPolicy defaultRetryPolicy) {
        this.name = name;
        this.steps = List.copyOf(steps);
        this.stateMachine = SagaStateMachine.compile(this.steps);
        this.defaultTimeout = defaultTimeout == null ? Duration.ZERO : defaultTimeout;
        this.defaultRetryPolicy = defaultRetryPolicy;
    }

    public String getName() {
        return name;
    }

    /**
     * @return steps in execution order; compensation walks them backwards
     */
    public List<SagaStep> getSteps() {
        return steps;
    }

    public Optional<SagaStep> findStep(String stepName) {
        return steps.stream().filter(step -> step.getName().equals(stepName)).findFirst();
    }

    public SagaStateMachine getStateMachine() {
        return stateMachine;
    }

    public Duration getDefaultTimeout() {
        return defaultTimeout;
    }

    /**
     * @return the saga-wide retry policy, or {@code null} when none was configured
     */
    public RetryPolicy getDefaultRetryPolicy() {
        return defaultRetryPolicy;
    }

    /**
     * Creates a pending instance with a fresh id. A correlation id is generated when the
     * context has none.
     */
    public SagaInstance createInstance(SagaContext context) {
        SagaContext effective = context == null ? new SagaContext() : context;
        String correlationId = effective.getCorrelationId();
        if (correlationId == null || correlationId.isEmpty()) {
            effective.setCorrelationId(UUID.randomUUID().toString());
        }
        return new SagaInstance(UUID.randomUUID().toString(), this, effective);
    }

    @Override
    public String toString() {
        return "SagaDefinition[" + name + ", steps=" + steps.size() + "]";
    }
}
