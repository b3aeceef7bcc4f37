package com.nayem.sagaflow.saga;

import com.nayem.sagaflow.events.DomainEvent;
import com.nayem.sagaflow.events.EventBus;
import com.nayem.sagaflow.events.SagaEventTypes;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Starts, resumes, compensates and cancels saga instances.
 * <p>
 * Every executing saga is tracked in a running set together with its cancellation
 * handle; the entry is always released when execution ends. Saga-level lifecycle
 * events are published here, step-level events by the instance itself.
 * </p>
 */
public class SagaOrchestrator implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(SagaOrchestrator.class);

    private final SagaRegistry registry;
    private final SagaPersistence persistence;
    private final EventBus eventBus;
    private final SagaMetrics metrics;
    private final Duration sagaTimeout;
    private final RetryPolicy defaultRetryPolicy;
    private final ExecutorService executor;
    private final ScheduledExecutorService watchdog;
    private final Map<String, RunningSaga> runningSagas = new ConcurrentHashMap<>();

    public SagaOrchestrator(SagaRegistry registry, SagaPersistence persistence, EventBus eventBus) {
        this(registry, persistence, eventBus, SagaMetrics.noOp(), Duration.ZERO, null, "sagaflow-saga-");
    }

    /**
     * @param registry           Definitions by name, needed by {@link #startSaga} and {@link #resume}
     * @param persistence        State storage, may be {@code null} (resume and status lookups then fail)
     * @param eventBus           Lifecycle event sink, may be {@code null}
     * @param metrics            Metrics sink
     * @param sagaTimeout        Default saga-wide deadline, {@link Duration#ZERO} for none
     * @param defaultRetryPolicy Saga-wide retry policy for contexts without one, may be {@code null}
     * @param threadNamePrefix   Prefix for the threads running asynchronous sagas
     */
    public SagaOrchestrator(
            SagaRegistry registry,
            SagaPersistence persistence,
            EventBus eventBus,
            SagaMetrics metrics,
            Duration sagaTimeout,
            RetryPolicy defaultRetryPolicy,
            String threadNamePrefix) {
        this.registry = registry;
        this.persistence = persistence;
        this.eventBus = eventBus;
        this.metrics = metrics == null ? SagaMetrics.noOp() : metrics;
        this.sagaTimeout = sagaTimeout == null ? Duration.ZERO : sagaTimeout;
        this.defaultRetryPolicy = defaultRetryPolicy;
        this.executor = Executors.newCachedThreadPool(SagaThreads.daemonFactory(threadNamePrefix));
        this.watchdog = Executors.newSingleThreadScheduledExecutor(
                SagaThreads.daemonFactory(threadNamePrefix + "watchdog-"));
    }

    public void registerSaga(String name, SagaDefinition definition) {
        registry.register(name, definition);
    }

    public SagaRegistry getRegistry() {
        return registry;
    }

    /**
     * Creates a pending instance of a registered definition, bound to this orchestrator's
     * persistence and event bus.
     */
    public SagaInstance createInstance(String definitionName, SagaContext context) {
        SagaDefinition definition = registry.get(definitionName);
        SagaContext effective = context == null ? new SagaContext() : context;
        if (defaultRetryPolicy != null && effective.metadata().retryPolicy() == null) {
            effective.setRetryPolicy(defaultRetryPolicy);
        }
        return definition.createInstance(effective).bind(persistence, eventBus, metrics);
    }

    /**
     * Creates an instance and executes it in the background.
     *
     * @return the created instance, immediately
     */
    public SagaInstance startSaga(String definitionName, SagaContext context) {
        SagaInstance instance = createInstance(definitionName, context);
        executeAsync(instance);
        return instance;
    }

    /**
     * Executes the saga on the orchestrator's pool. The saga counts as running from the
     * moment this method returns.
     *
     * @return completes with the final status; never completes exceptionally for step
     *         failures, only for errors the saga could not record (persistence, state)
     */
    public CompletableFuture<SagaStatus> executeAsync(SagaInstance instance) {
        return submit(instance, track(instance.getId(), instance.getStatus()));
    }

    private CompletableFuture<SagaStatus> submit(SagaInstance instance, RunningSaga run) {
        CompletableFuture<SagaStatus> result = new CompletableFuture<>();
        try {
            executor.execute(() -> {
                try {
                    runTracked(instance, run);
                    result.complete(instance.getStatus());
                } catch (SagaStepException e) {
                    result.complete(instance.getStatus());
                } catch (Throwable t) {
                    result.completeExceptionally(t);
                }
            });
        } catch (RuntimeException e) {
            runningSagas.remove(instance.getId(), run);
            throw e;
        }
        return result;
    }

    /**
     * Executes the saga on the calling thread.
     *
     * @throws SagaStepException        when a step failed (the saga is compensated or failed)
     * @throws SagaStateException       when the saga is not pending
     * @throws SagaPersistenceException when state could not be saved
     */
    public void execute(SagaInstance instance) {
        runTracked(instance, track(instance.getId(), instance.getStatus()));
    }

    private RunningSaga track(String sagaId, SagaStatus status) {
        RunningSaga run = new RunningSaga(sagaId);
        RunningSaga existing = runningSagas.putIfAbsent(sagaId, run);
        if (existing != null) {
            throw new SagaStateException(sagaId, status, "saga " + sagaId + " is already running");
        }
        return run;
    }

    private void runTracked(SagaInstance instance, RunningSaga run) {
        String sagaId = instance.getId();
        SagaStatus status = instance.getStatus();
        if (status != SagaStatus.PENDING) {
            runningSagas.remove(sagaId, run);
            throw new SagaStateException(sagaId, status,
                    "saga " + sagaId + " is not in pending status, current: " + status.value());
        }
        instance.bind(persistence, eventBus, metrics);
        run.attach(Thread.currentThread(), instance);
        ScheduledFuture<?> deadline = scheduleTimeout(instance, run);

        Map<String, Object> started = new LinkedHashMap<>();
        started.put(SagaEventTypes.SAGA_ID, sagaId);
        started.put(SagaEventTypes.DEFINITION_NAME, instance.getDefinition().getName());
        publish(SagaEventTypes.SAGA_STARTED, instance, started);
        log.info("Saga {} ({}) started", sagaId, instance.getDefinition().getName());

        RuntimeException failure = null;
        try {
            instance.execute();
        } catch (RuntimeException e) {
            failure = e;
        } finally {
            if (deadline != null) {
                deadline.cancel(false);
            }
            run.detach();
            runningSagas.remove(sagaId, run);
        }

        Duration elapsed = Duration.between(instance.getContext().metadata().createdAt(), Instant.now());
        metrics.recordSagaDuration(elapsed);
        if (failure == null) {
            Map<String, Object> completed = new LinkedHashMap<>();
            completed.put(SagaEventTypes.SAGA_ID, sagaId);
            completed.put(SagaEventTypes.DURATION_MS, elapsed.toMillis());
            completed.put(SagaEventTypes.STEPS_COMPLETED, instance.getHistory().size());
            publish(SagaEventTypes.SAGA_COMPLETED, instance, completed);
            metrics.recordCompletedSaga();
        } else {
            Map<String, Object> failed = new LinkedHashMap<>();
            failed.put(SagaEventTypes.SAGA_ID, sagaId);
            failed.put(SagaEventTypes.ERROR, SagaStepException.describe(failure));
            if (failure instanceof SagaStepException) {
                failed.put(SagaEventTypes.FAILED_STEP, ((SagaStepException) failure).getStepName());
            }
            failed.put(SagaEventTypes.STATUS, instance.getStatus().value());
            publish(SagaEventTypes.SAGA_FAILED, instance, failed);
            metrics.recordFailedSaga();
            if (run.isCancelled()) {
                metrics.recordCancelledSaga();
            }
            log.warn("Saga {} ended {}: {}", sagaId, instance.getStatus().value(), failure.getMessage());
        }

        // a rejected start changed nothing worth saving
        if (!(failure instanceof SagaStateException)) {
            saveFinalState(instance, failure);
        }
        if (failure != null) {
            throw failure;
        }
    }

    /**
     * Compensates the saga's completed steps out of band (manual intervention).
     */
    public void compensate(SagaInstance instance) {
        instance.bind(persistence, eventBus, metrics);
        Map<String, Object> compensating = new LinkedHashMap<>();
        compensating.put(SagaEventTypes.SAGA_ID, instance.getId());
        compensating.put(SagaEventTypes.REASON, "manual_compensation");
        publish(SagaEventTypes.SAGA_COMPENSATING, instance, compensating);

        RuntimeException failure = null;
        try {
            instance.compensate();
            long compensatedSteps = instance.getHistory().stream()
                    .filter(entry -> entry.status() == StepStatus.COMPENSATED)
                    .count();
            Map<String, Object> compensated = new LinkedHashMap<>();
            compensated.put(SagaEventTypes.SAGA_ID, instance.getId());
            compensated.put(SagaEventTypes.COMPENSATED_STEPS, compensatedSteps);
            publish(SagaEventTypes.SAGA_COMPENSATED, instance, compensated);
        } catch (RuntimeException e) {
            failure = e;
        }
        saveFinalState(instance, failure);
        if (failure != null) {
            throw failure;
        }
    }

    /**
     * Loads a persisted saga and runs all of its steps again. Steps must be idempotent.
     *
     * @throws SagaStateException when the saga is neither running nor pending, or is
     *                            already executing in this orchestrator
     */
    public void resume(String sagaId) {
        RunningSaga run = track(sagaId, SagaStatus.RUNNING);
        runTracked(prepareResume(sagaId, run), run);
    }

    public CompletableFuture<SagaStatus> resumeAsync(String sagaId) {
        RunningSaga run = track(sagaId, SagaStatus.RUNNING);
        return submit(prepareResume(sagaId, run), run);
    }

    // the caller already tracks sagaId, so a live instance is never reset under its executor
    private SagaInstance prepareResume(String sagaId, RunningSaga run) {
        try {
            SagaInstance instance = requirePersistence(sagaId).load(sagaId);
            instance.prepareResume();
            log.info("Resuming saga {} ({})", sagaId, instance.getDefinition().getName());
            return instance;
        } catch (RuntimeException e) {
            runningSagas.remove(sagaId, run);
            throw e;
        }
    }

    public SagaStatus getStatus(String sagaId) {
        return requirePersistence(sagaId).load(sagaId).getStatus();
    }

    /**
     * Stops a running saga. The in-flight step fails with a cancellation error and the
     * completed steps are compensated by the executing thread.
     *
     * @throws SagaNotRunningException when the saga is not tracked as running
     */
    public void cancel(String sagaId) {
        RunningSaga run = runningSagas.remove(sagaId);
        if (run == null) {
            throw new SagaNotRunningException(sagaId);
        }
        log.info("Cancelling saga {}", sagaId);
        run.cancel();
    }

    public boolean isRunning(String sagaId) {
        return runningSagas.containsKey(sagaId);
    }

    public Set<String> runningSagaIds() {
        return new TreeSet<>(runningSagas.keySet());
    }

    private ScheduledFuture<?> scheduleTimeout(SagaInstance instance, RunningSaga run) {
        Duration timeout = instance.getContext().metadata().timeout();
        if (timeout.isZero()) {
            timeout = sagaTimeout;
        }
        if (timeout.isZero() || timeout.isNegative()) {
            return null;
        }
        Duration limit = timeout;
        return watchdog.schedule(() -> {
            if (runningSagas.remove(instance.getId(), run)) {
                log.warn("Saga {} timed out after {}ms", instance.getId(), limit.toMillis());
                metrics.recordTimedOutSaga();
                run.cancel();
            }
        }, timeout.toNanos(), TimeUnit.NANOSECONDS);
    }

    private void saveFinalState(SagaInstance instance, RuntimeException failure) {
        if (persistence == null) {
            return;
        }
        try {
            persistence.save(instance);
        } catch (RuntimeException e) {
            if (failure == null) {
                throw e instanceof SagaPersistenceException ? e
                        : new SagaPersistenceException(instance.getId(), "failed to save final saga state", e);
            }
            failure.addSuppressed(e);
        }
    }

    private SagaPersistence requirePersistence(String sagaId) {
        if (persistence == null) {
            throw new SagaPersistenceException(sagaId, "no saga persistence configured");
        }
        return persistence;
    }

    private void publish(String eventType, SagaInstance instance, Map<String, Object> metadata) {
        if (eventBus == null) {
            return;
        }
        try {
            eventBus.publish(DomainEvent.of(eventType, instance.getId(),
                    instance.getContext().getCorrelationId(), metadata));
        } catch (RuntimeException e) {
            log.warn("Failed to publish {} for saga {}: {}", eventType, instance.getId(), e.getMessage());
        }
    }

    @Override
    public void close() {
        shutdown();
    }

    public void shutdown() {
        runningSagas.values().forEach(RunningSaga::cancel);
        watchdog.shutdownNow();
        executor.shutdownNow();
    }

    /**
     * Cancellation handle of one executing saga: marks the instance cancelled and
     * interrupts the thread running it.
     */
    private static final class RunningSaga {
        private final String sagaId;
        private Thread worker;
        private SagaInstance instance;
        private boolean cancelled;

        RunningSaga(String sagaId) {
            this.sagaId = sagaId;
        }

        synchronized void attach(Thread thread, SagaInstance sagaInstance) {
            worker = thread;
            instance = sagaInstance;
            if (cancelled) {
                sagaInstance.cancel();
                thread.interrupt();
            }
        }

        synchronized void detach() {
            worker = null;
            if (cancelled) {
                // drop an interrupt that arrived after the last step finished
                Thread.interrupted();
            }
        }

        synchronized void cancel() {
            cancelled = true;
            if (instance != null) {
                instance.cancel();
            }
            if (worker != null) {
                log.debug("Interrupting saga {} on {}", sagaId, worker.getName());
                worker.interrupt();
            }
        }

        synchronized boolean isCancelled() {
            return cancelled;
        }
    }
}
