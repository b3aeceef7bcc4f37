package com.nayem.sagaflow.saga;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * A fluent builder for {@link SagaDefinition}s.
 *
 * <h3>Example Usage:</h3>
 *
 * <pre>{@code
 * SagaDefinition orderSaga = SagaBuilder.newSaga("order")
 *         .step(FunctionalSagaStep.builder()
 *                 .name("reserve_inventory")
 *                 .execute(ctx -> inventory.reserve(ctx.getString("order_id")))
 *                 .compensate(ctx -> inventory.release(ctx.getString("order_id")))
 *                 .build())
 *         .step(FunctionalSagaStep.builder()
 *                 .name("charge_payment")
 *                 .execute(ctx -> payments.charge(ctx.getString("order_id")))
 *                 .build())
 *         .retryPolicy(RetryPolicy.simple(3))
 *         .build();
 * }</pre>
 */
public class SagaBuilder {

    private final String name;
    private final List<SagaStep> steps = new ArrayList<>();
    private Duration timeout = Duration.ZERO;
    private RetryPolicy retryPolicy;

    private SagaBuilder(String name) {
        this.name = name;
    }

    /**
     * Creates a new SagaBuilder.
     *
     * @param name Registry key of the definition
     * @return A new builder instance
     */
    public static SagaBuilder newSaga(String name) {
        return new SagaBuilder(name);
    }

    /**
     * Adds a step to the saga.
     * Steps are executed in the order they are added.
     */
    public SagaBuilder step(SagaStep step) {
        this.steps.add(step);
        return this;
    }

    public SagaBuilder steps(List<? extends SagaStep> steps) {
        this.steps.addAll(steps);
        return this;
    }

    /**
     * Per-attempt timeout for steps that do not declare their own.
     */
    public SagaBuilder timeout(Duration timeout) {
        this.timeout = timeout;
        return this;
    }

    /**
     * Retry policy for steps that do not declare their own.
     */
    public SagaBuilder retryPolicy(RetryPolicy retryPolicy) {
        this.retryPolicy = retryPolicy;
        return this;
    }

    /**
     * Builds the definition.
     *
     * @throws IllegalStateException if the name is missing, no steps are defined or
     *                               two steps share a name
     */
    public SagaDefinition build() {
        if (name == null || name.isBlank()) {
            throw new IllegalStateException("saga name is required");
        }
        if (steps.isEmpty()) {
            throw new IllegalStateException("saga must have at least one step");
        }
        Set<String> names = new HashSet<>();
        for (SagaStep step : steps) {
            if (step == null || step.getName() == null || step.getName().isBlank()) {
                throw new IllegalStateException("every step needs a name");
            }
            if (!names.add(step.getName())) {
                throw new IllegalStateException("duplicate step name: " + step.getName());
            }
        }
        if (timeout != null && timeout.isNegative()) {
            throw new IllegalStateException("timeout must not be negative");
        }
        return new SagaDefinition(name, steps, timeout, retryPolicy);
    }
}
