package com.nayem.sagaflow.saga;

import java.time.Duration;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs one step attempt, bounded by the step's deadline when it has one.
 * <p>
 * A timed attempt runs on a pool thread while the saga thread waits; the attempt is
 * always cancelled once the wait ends, whatever the outcome.
 * </p>
 */
final class StepInvoker {

    private final ExecutorService executor;

    StepInvoker(ExecutorService executor) {
        this.executor = executor;
    }

    void invoke(String sagaId, SagaStep step, SagaContext context, Duration timeout) throws Exception {
        if (timeout == null || timeout.isZero() || timeout.isNegative()) {
            step.execute(context);
            return;
        }

        Future<?> attempt = executor.submit(() -> {
            step.execute(context);
            return null;
        });
        try {
            attempt.get(timeout.toNanos(), TimeUnit.NANOSECONDS);
        } catch (TimeoutException e) {
            throw new StepTimeoutException(sagaId, step.getName(), timeout);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof Exception) {
                throw (Exception) cause;
            }
            if (cause instanceof Error) {
                throw (Error) cause;
            }
            throw e;
        } finally {
            attempt.cancel(true);
        }
    }
}
