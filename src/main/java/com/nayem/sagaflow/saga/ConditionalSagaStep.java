package com.nayem.sagaflow.saga;

import java.time.Duration;

/**
 * Runs an inner step only when a condition holds.
 * <p>
 * A false condition is a successful skip, not a failure. The skip is recorded in the
 * context under {@code <name>.skipped} and a skipped step is never compensated.
 * </p>
 */
public class ConditionalSagaStep implements SagaStep {

    private final String name;
    private final StepGuard condition;
    private final SagaStep inner;
    private final StepOptions options;

    public ConditionalSagaStep(String name, StepGuard condition, SagaStep inner) {
        this(name, condition, inner, StepOptions.defaults());
    }

    public ConditionalSagaStep(String name, StepGuard condition, SagaStep inner, StepOptions options) {
        if (name == null || name.isBlank()) {
            throw new IllegalStateException("step name is required");
        }
        if (condition == null) {
            throw new IllegalStateException("condition is required for step " + name);
        }
        if (inner == null) {
            throw new IllegalStateException("inner step is required for step " + name);
        }
        this.name = name;
        this.condition = condition;
        this.inner = inner;
        this.options = options == null ? StepOptions.defaults() : options;
    }

    @Override
    public String getName() {
        return name;
    }

    public SagaStep getInner() {
        return inner;
    }

    public String skippedKey() {
        return name + ".skipped";
    }

    @Override
    public void execute(SagaContext context) throws Exception {
        if (!condition.test(context)) {
            context.set(skippedKey(), true);
            return;
        }
        context.set(skippedKey(), false);
        if (!inner.canExecute(context)) {
            throw new IllegalStateException("step " + inner.getName() + " guard check failed");
        }
        inner.execute(context);
    }

    @Override
    public void compensate(SagaContext context) throws Exception {
        if (context.getBool(skippedKey(), false)) {
            return;
        }
        inner.compensate(context);
    }

    @Override
    public boolean canExecute(SagaContext context) {
        return options.allows(context);
    }

    @Override
    public Duration getTimeout() {
        return options.timeout().isZero() ? inner.getTimeout() : options.timeout();
    }

    @Override
    public RetryPolicy getRetryPolicy() {
        return options.retryPolicy() != null ? options.retryPolicy() : inner.getRetryPolicy();
    }
}
