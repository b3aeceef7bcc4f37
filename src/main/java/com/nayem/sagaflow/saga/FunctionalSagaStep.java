package com.nayem.sagaflow.saga;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A sequential {@link SagaStep} defined with lambdas.
 * <p>
 * This eliminates the need to create a separate class for every saga step,
 * reducing boilerplate significantly for simple operations.
 * </p>
 *
 * <h3>Example Usage:</h3>
 *
 * <pre>{@code
 * SagaStep reserve = FunctionalSagaStep.builder()
 *         .name("reserve_inventory")
 *         .execute(ctx -> inventory.reserve(ctx.getString("order_id")))
 *         .compensate(ctx -> inventory.release(ctx.getString("order_id")))
 *         .retryPolicy(RetryPolicy.exponentialBackoff(3, Duration.ofMillis(200), 2.0))
 *         .build();
 * }</pre>
 */
public class FunctionalSagaStep implements SagaStep {

    private final String name;
    private final StepAction executor;
    private final StepAction compensator;
    private final StepOptions options;
    private final Map<String, Object> metadata;

    private FunctionalSagaStep(Builder builder) {
        this.name = builder.name;
        this.executor = builder.executor;
        this.compensator = builder.compensator;
        this.options = builder.options;
        this.metadata = Map.copyOf(builder.metadata);
    }

    /**
     * Creates a new builder for FunctionalSagaStep.
     *
     * @return A new builder instance
     */
    public static Builder builder() {
        return new Builder();
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public void execute(SagaContext context) throws Exception {
        executor.run(context);
    }

    @Override
    public void compensate(SagaContext context) throws Exception {
        if (compensator != null) {
            compensator.run(context);
        }
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

    public StepOptions getOptions() {
        return options;
    }

    public Map<String, Object> getMetadata() {
        return metadata;
    }

    /**
     * Builder for creating {@link FunctionalSagaStep} instances.
     */
    public static class Builder {
        private String name;
        private StepAction executor;
        private StepAction compensator;
        private StepOptions options = StepOptions.defaults();
        private final Map<String, Object> metadata = new LinkedHashMap<>();

        /**
         * Sets the unique step name.
         */
        public Builder name(String name) {
            this.name = name;
            return this;
        }

        /**
         * Sets the forward execution logic.
         */
        public Builder execute(StepAction executor) {
            this.executor = executor;
            return this;
        }

        /**
         * Sets the compensation logic for rollback. Optional.
         */
        public Builder compensate(StepAction compensator) {
            this.compensator = compensator;
            return this;
        }

        public Builder guard(StepGuard guard) {
            this.options = options.withGuard(guard);
            return this;
        }

        /**
         * Sets the per-attempt deadline. Default: none
         */
        public Builder timeout(Duration timeout) {
            this.options = options.withTimeout(timeout);
            return this;
        }

        public Builder retryPolicy(RetryPolicy retryPolicy) {
            this.options = options.withRetryPolicy(retryPolicy);
            return this;
        }

        public Builder options(StepOptions options) {
            this.options = options == null ? StepOptions.defaults() : options;
            return this;
        }

        public Builder metadata(String key, Object value) {
            this.metadata.put(key, value);
            return this;
        }

        /**
         * Builds the FunctionalSagaStep.
         *
         * @throws IllegalStateException if required fields are missing
         */
        public FunctionalSagaStep build() {
            if (name == null || name.isBlank()) {
                throw new IllegalStateException("step name is required");
            }
            if (executor == null) {
                throw new IllegalStateException("execute action is required for step " + name);
            }
            return new FunctionalSagaStep(this);
        }
    }
}
