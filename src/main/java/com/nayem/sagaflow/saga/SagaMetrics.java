package com.nayem.sagaflow.saga;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Prometheus metrics for Saga orchestration health and performance monitoring.
 */
public class SagaMetrics {

    private final Map<SagaStatus, AtomicLong> sagasByStatus;
    private final Timer sagaDurationTimer;
    private final Timer stepExecutionTimer;
    private final Counter compensationCounter;
    private final Counter stepRetryCounter;
    private final Counter recoveryAttemptCounter;
    private final Counter timeoutCounter;
    private final Counter cancelledCounter;
    private final Counter failedSagaCounter;
    private final Counter successfulSagaCounter;

    public SagaMetrics(MeterRegistry registry) {
        this.sagasByStatus = new EnumMap<>(SagaStatus.class);
        for (SagaStatus status : SagaStatus.values()) {
            sagasByStatus.put(status, new AtomicLong());
        }

        if (registry != null) {
            sagasByStatus.forEach((status, count) -> Gauge.builder("sagaflow.saga.active", count, AtomicLong::get)
                    .description("Number of sagas by status")
                    .tag("status", status.value())
                    .register(registry));

            this.sagaDurationTimer = Timer.builder("sagaflow.saga.duration")
                    .description("Total saga execution duration")
                    .register(registry);

            this.stepExecutionTimer = Timer.builder("sagaflow.saga.step.execution")
                    .description("Individual step execution duration")
                    .register(registry);

            this.compensationCounter = Counter.builder("sagaflow.saga.compensation.count")
                    .description("Number of compensation triggers")
                    .register(registry);

            this.stepRetryCounter = Counter.builder("sagaflow.saga.step.retries")
                    .description("Number of step retries")
                    .register(registry);

            this.recoveryAttemptCounter = Counter.builder("sagaflow.saga.recovery.attempts")
                    .description("Number of saga recovery attempts")
                    .register(registry);

            this.timeoutCounter = Counter.builder("sagaflow.saga.timeout.count")
                    .description("Number of saga timeouts")
                    .register(registry);

            this.cancelledCounter = Counter.builder("sagaflow.saga.cancelled")
                    .description("Number of cancelled sagas")
                    .register(registry);

            this.failedSagaCounter = Counter.builder("sagaflow.saga.failed")
                    .description("Number of sagas that did not complete")
                    .register(registry);

            this.successfulSagaCounter = Counter.builder("sagaflow.saga.successful")
                    .description("Number of successful sagas")
                    .register(registry);
        } else {
            this.sagaDurationTimer = null;
            this.stepExecutionTimer = null;
            this.compensationCounter = null;
            this.stepRetryCounter = null;
            this.recoveryAttemptCounter = null;
            this.timeoutCounter = null;
            this.cancelledCounter = null;
            this.failedSagaCounter = null;
            this.successfulSagaCounter = null;
        }
    }

    public void recordStatusChange(SagaStatus oldStatus, SagaStatus newStatus) {
        if (oldStatus != null) {
            sagasByStatus.get(oldStatus).decrementAndGet();
        }
        if (newStatus != null) {
            sagasByStatus.get(newStatus).incrementAndGet();
        }
    }

    public long countByStatus(SagaStatus status) {
        return sagasByStatus.get(status).get();
    }

    public void recordSagaDuration(Duration duration) {
        if (sagaDurationTimer != null) {
            sagaDurationTimer.record(duration);
        }
    }

    public void recordStepDuration(Duration duration) {
        if (stepExecutionTimer != null) {
            stepExecutionTimer.record(duration);
        }
    }

    public void recordCompletedSaga() {
        if (successfulSagaCounter != null) {
            successfulSagaCounter.increment();
        }
    }

    public void recordFailedSaga() {
        if (failedSagaCounter != null) {
            failedSagaCounter.increment();
        }
    }

    public void recordTimedOutSaga() {
        if (timeoutCounter != null) {
            timeoutCounter.increment();
        }
    }

    public void recordCancelledSaga() {
        if (cancelledCounter != null) {
            cancelledCounter.increment();
        }
    }

    public void recordCompensationTriggered() {
        if (compensationCounter != null) {
            compensationCounter.increment();
        }
    }

    public void recordStepRetry() {
        if (stepRetryCounter != null) {
            stepRetryCounter.increment();
        }
    }

    public void recordRecoveredSagas(int count) {
        if (recoveryAttemptCounter != null) {
            recoveryAttemptCounter.increment(count);
        }
    }

    public static SagaMetrics noOp() {
        return new SagaMetrics(null);
    }
}
