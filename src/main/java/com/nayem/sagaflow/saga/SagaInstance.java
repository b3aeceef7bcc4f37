package com.nayem.sagaflow.saga;

import com.nayem.sagaflow.events.DomainEvent;
import com.nayem.sagaflow.events.EventBus;
import com.nayem.sagaflow.events.SagaEventTypes;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * One run of a {@link SagaDefinition}.
 * <p>
 * Status moves {@code PENDING -> RUNNING -> COMPLETED}, or through
 * {@code COMPENSATING} to {@code COMPENSATED} or {@code FAILED}. State is persisted
 * after every transition and Step* lifecycle events are published on the bound bus.
 * </p>
 * <p>
 * Cancellation marks the instance cancelled and interrupts the thread running
 * {@link #execute()}. The mark outlives the interrupt, so a step that swallows
 * {@link InterruptedException} still ends its attempt loop: the in-flight step fails with a
 * {@link SagaCancelledException} and the completed steps are compensated as for any
 * other failure.
 * </p>
 * <p>
 * Timestamps never go backwards within one instance and every history entry starts
 * strictly after the previous one, so {@code (stepName, startedAt)} stays unique even
 * on a coarse clock.
 * </p>
 */
public class SagaInstance {

    private static final Logger log = LoggerFactory.getLogger(SagaInstance.class);

    private final String id;
    private final SagaDefinition definition;
    private final SagaContext context;
    private final ReadWriteLock lock = new ReentrantReadWriteLock();
    private final List<SagaHistory> history = new ArrayList<>();
    private final SagaStateMachine.Cursor cursor;

    private SagaStatus status = SagaStatus.PENDING;
    private String currentStep;
    private Instant startedAt;
    private Instant completedAt;
    private volatile boolean cancelled;

    private final Object timeLock = new Object();
    private Instant lastTimestamp = Instant.MIN;
    private Instant lastEntryStart = Instant.MIN;

    private volatile SagaPersistence persistence;
    private volatile EventBus eventBus;
    private volatile SagaMetrics metrics = SagaMetrics.noOp();
    private volatile Clock clock = Clock.systemUTC();
    private volatile StepInvoker stepInvoker = new StepInvoker(SagaThreads.stepPool());

    SagaInstance(String id, SagaDefinition definition, SagaContext context) {
        this.id = id;
        this.definition = definition;
        this.context = context;
        this.cursor = definition.getStateMachine().start();
    }

    /**
     * Rebuilds an instance from persisted state. The result is not bound to any
     * persistence or event bus.
     */
    public static SagaInstance restore(String id, SagaDefinition definition, SagaContext context,
            SagaStatus status, String currentStep, List<SagaHistory> history,
            Instant startedAt, Instant completedAt) {
        SagaInstance instance = new SagaInstance(id, definition, context);
        instance.status = status;
        instance.currentStep = currentStep;
        instance.history.addAll(history);
        for (SagaHistory entry : history) {
            if (entry.startedAt() != null && entry.startedAt().isAfter(instance.lastEntryStart)) {
                instance.lastEntryStart = entry.startedAt();
            }
        }
        instance.startedAt = startedAt;
        instance.completedAt = completedAt;
        return instance;
    }

    /**
     * Attaches collaborators; {@code null} arguments leave the current binding untouched.
     */
    public SagaInstance bind(SagaPersistence persistence, EventBus eventBus, SagaMetrics metrics) {
        if (persistence != null) {
            this.persistence = persistence;
        }
        if (eventBus != null) {
            this.eventBus = eventBus;
        }
        if (metrics != null && metrics != this.metrics) {
            this.metrics = metrics;
            metrics.recordStatusChange(null, getStatus());
        }
        return this;
    }

    SagaInstance withClock(Clock clock) {
        this.clock = clock;
        return this;
    }

    public String getId() {
        return id;
    }

    public SagaDefinition getDefinition() {
        return definition;
    }

    public SagaContext getContext() {
        return context;
    }

    public SagaStatus getStatus() {
        lock.readLock().lock();
        try {
            return status;
        } finally {
            lock.readLock().unlock();
        }
    }

    public String getCurrentStep() {
        lock.readLock().lock();
        try {
            return currentStep;
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * @return a copy of the history in recording order
     */
    public List<SagaHistory> getHistory() {
        lock.readLock().lock();
        try {
            return List.copyOf(history);
        } finally {
            lock.readLock().unlock();
        }
    }

    public Instant getStartedAt() {
        lock.readLock().lock();
        try {
            return startedAt;
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * @return when the saga reached a terminal status, {@code null} before that
     */
    public Instant getCompletedAt() {
        lock.readLock().lock();
        try {
            return completedAt;
        } finally {
            lock.readLock().unlock();
        }
    }

    public String getStateMachineState() {
        return cursor.current();
    }

    /**
     * Runs every step in order, compensating the completed ones when a step fails.
     *
     * @throws SagaStateException       if the saga is not pending
     * @throws SagaStepException        if a step failed; the saga ends compensated, or
     *                                  failed when the compensation failed too
     * @throws SagaPersistenceException if state could not be saved
     */
    public void execute() {
        Instant now = now();
        lock.writeLock().lock();
        try {
            if (status != SagaStatus.PENDING) {
                throw new SagaStateException(id, status,
                        "saga " + id + " is not in pending status, current: " + status.value());
            }
            changeStatus(SagaStatus.RUNNING);
            startedAt = now;
            completedAt = null;
        } finally {
            lock.writeLock().unlock();
        }
        context.touch(now);
        cursor.reset();
        persist("after start");

        List<SagaStep> steps = definition.getSteps();
        for (int i = 0; i < steps.size(); i++) {
            runStep(i, steps.get(i));
        }

        Instant finishedAt = now();
        lock.writeLock().lock();
        try {
            changeStatus(SagaStatus.COMPLETED);
            completedAt = finishedAt;
        } finally {
            lock.writeLock().unlock();
        }
        context.touch(finishedAt);
        persist("after completion");
        log.info("Saga {} ({}) completed", id, definition.getName());
    }

    /**
     * Compensates every completed step in reverse order. Manual intervention path,
     * legal while running or after completion.
     *
     * @throws SagaCompensationException when a compensation fails; the saga is then failed
     */
    public void compensate() {
        lock.writeLock().lock();
        try {
            if (status != SagaStatus.RUNNING && status != SagaStatus.COMPLETED) {
                throw new SagaStateException(id, status,
                        "saga " + id + " cannot be compensated, current status: " + status.value());
            }
            changeStatus(SagaStatus.COMPENSATING);
        } finally {
            lock.writeLock().unlock();
        }
        context.touch(now());
        metrics.recordCompensationTriggered();
        persist("before compensation");
        compensateSteps(definition.getSteps().size() - 1);
    }

    /**
     * Puts a running or pending saga back to pending so {@link #execute()} can run all
     * steps again.
     */
    public void prepareResume() {
        lock.writeLock().lock();
        try {
            if (status != SagaStatus.RUNNING && status != SagaStatus.PENDING) {
                throw new SagaStateException(id, status,
                        "saga " + id + " cannot be resumed, current status: " + status.value());
            }
            changeStatus(SagaStatus.PENDING);
            completedAt = null;
            cancelled = false;
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Marks the saga cancelled. The running step's attempt loop stops at its next check
     * and no further step starts.
     */
    void cancel() {
        cancelled = true;
    }

    boolean isCancelled() {
        return cancelled;
    }

    private boolean cancellationRequested() {
        return Thread.interrupted() || cancelled;
    }

    private void runStep(int index, SagaStep step) {
        String name = step.getName();
        SagaHistory entry = SagaHistory.running(name, nextEntryStart());
        lock.writeLock().lock();
        try {
            currentStep = name;
            history.add(entry);
        } finally {
            lock.writeLock().unlock();
        }
        if (!cursor.fire(SagaStateMachine.eventFor(name))) {
            log.debug("Saga {} state machine has no transition {} from {}", id,
                    SagaStateMachine.eventFor(name), cursor.current());
        }
        publish(SagaEventTypes.STEP_STARTED, StepEvents.toMetadata(entry));

        Attempt outcome;
        if (cancellationRequested()) {
            outcome = new Attempt(0, new SagaCancelledException(id, name, null));
        } else {
            outcome = guardAndRun(step);
        }

        if (outcome.error() != null) {
            SagaHistory failed = entry.failed(now(), SagaStepException.describe(outcome.error()), outcome.attempt());
            updateHistory(failed);
            publish(SagaEventTypes.STEP_FAILED, StepEvents.toMetadata(failed));
            log.warn("Saga {} step {} failed after {} attempt(s): {}", id, name, outcome.attempt() + 1,
                    SagaStepException.describe(outcome.error()));
            compensateAfterFailure(index - 1, new SagaStepException(id, name, outcome.error()));
        }

        SagaHistory completed = entry.completed(now(), outcome.attempt());
        updateHistory(completed);
        metrics.recordStepDuration(completed.duration());
        publish(SagaEventTypes.STEP_COMPLETED, StepEvents.toMetadata(completed));
        context.touch(completed.completedAt());
        persist("after step " + name);
    }

    private Attempt guardAndRun(SagaStep step) {
        boolean allowed;
        try {
            allowed = step.canExecute(context);
        } catch (RuntimeException e) {
            return new Attempt(0, e);
        }
        if (!allowed) {
            return new Attempt(0, new StepGuardException(id, step.getName()));
        }
        return runWithRetry(step);
    }

    private Attempt runWithRetry(SagaStep step) {
        RetryPolicy policy = resolveRetryPolicy(step);
        Duration timeout = resolveTimeout(step);
        Exception lastError = null;

        for (int attempt = 0; attempt < policy.maxAttempts(); attempt++) {
            if (attempt > 0 && cancellationRequested()) {
                return new Attempt(attempt - 1, new SagaCancelledException(id, step.getName(), lastError));
            }
            try {
                stepInvoker.invoke(id, step, context, timeout);
                return new Attempt(attempt, null);
            } catch (InterruptedException e) {
                Thread.interrupted();
                return new Attempt(attempt, new SagaCancelledException(id, step.getName(), e));
            } catch (Exception e) {
                lastError = e;
            }
            if (cancellationRequested()) {
                return new Attempt(attempt, new SagaCancelledException(id, step.getName(), lastError));
            }
            if (!policy.shouldRetry(lastError, attempt)) {
                return new Attempt(attempt, lastError);
            }
            if (attempt < policy.maxAttempts() - 1) {
                Duration delay = policy.calculateDelay(attempt);
                log.warn("Saga {} step {} failed (attempt {}/{}), retrying in {}ms: {}",
                        id, step.getName(), attempt + 1, policy.maxAttempts(), delay.toMillis(),
                        SagaStepException.describe(lastError));
                metrics.recordStepRetry();
                try {
                    TimeUnit.NANOSECONDS.sleep(delay.toNanos());
                } catch (InterruptedException e) {
                    return new Attempt(attempt, new SagaCancelledException(id, step.getName(), e));
                }
            }
        }
        return new Attempt(policy.maxAttempts() - 1, lastError);
    }

    private RetryPolicy resolveRetryPolicy(SagaStep step) {
        if (step.getRetryPolicy() != null) {
            return step.getRetryPolicy();
        }
        RetryPolicy sagaWide = context.metadata().retryPolicy();
        if (sagaWide != null) {
            return sagaWide;
        }
        if (definition.getDefaultRetryPolicy() != null) {
            return definition.getDefaultRetryPolicy();
        }
        return RetryPolicy.noRetry();
    }

    private Duration resolveTimeout(SagaStep step) {
        Duration timeout = step.getTimeout();
        if (timeout != null && !timeout.isZero()) {
            return timeout;
        }
        return definition.getDefaultTimeout();
    }

    private void compensateAfterFailure(int lastIndex, SagaStepException stepError) {
        lock.writeLock().lock();
        try {
            changeStatus(SagaStatus.COMPENSATING);
        } finally {
            lock.writeLock().unlock();
        }
        metrics.recordCompensationTriggered();
        persist("after step " + stepError.getStepName() + " failed");

        try {
            compensateSteps(lastIndex);
        } catch (SagaCompensationException compensationError) {
            SagaStepException combined = new SagaStepException(id, stepError.getStepName(),
                    stepError.getMessage() + ", compensation also failed: " + compensationError.getMessage(),
                    stepError.getCause());
            combined.addSuppressed(compensationError);
            throw combined;
        }
        throw stepError;
    }

    private void compensateSteps(int uptoIndex) {
        List<SagaHistory> recorded = getHistory();
        List<SagaStep> steps = definition.getSteps();

        for (int i = uptoIndex; i >= 0; i--) {
            SagaStep step = steps.get(i);
            if (!lastExecutionCompleted(recorded, step.getName())) {
                continue;
            }
            String name = step.getName();
            SagaHistory entry = SagaHistory.compensating(name, nextEntryStart());
            lock.writeLock().lock();
            try {
                currentStep = name;
                history.add(entry);
            } finally {
                lock.writeLock().unlock();
            }
            publish(SagaEventTypes.STEP_COMPENSATING, StepEvents.toMetadata(entry));

            try {
                step.compensate(context);
            } catch (Exception e) {
                Instant failedAt = now();
                updateHistory(entry.failed(failedAt, SagaStepException.describe(e), 0));
                lock.writeLock().lock();
                try {
                    changeStatus(SagaStatus.FAILED);
                    completedAt = failedAt;
                } finally {
                    lock.writeLock().unlock();
                }
                context.touch(failedAt);
                log.error("Saga {} compensation of step {} failed, saga is now failed", id, name, e);
                persist("after compensation of step " + name + " failed");
                throw new SagaCompensationException(id, name, e);
            }

            SagaHistory compensated = entry.compensated(now());
            updateHistory(compensated);
            publish(SagaEventTypes.STEP_COMPENSATED, StepEvents.toMetadata(compensated));
            persist("after compensating step " + name);
        }

        Instant finishedAt = now();
        lock.writeLock().lock();
        try {
            changeStatus(SagaStatus.COMPENSATED);
            completedAt = finishedAt;
        } finally {
            lock.writeLock().unlock();
        }
        context.touch(finishedAt);
        persist("after compensation");
        log.info("Saga {} ({}) compensated", id, definition.getName());
    }

    private static boolean lastExecutionCompleted(List<SagaHistory> recorded, String stepName) {
        for (int i = recorded.size() - 1; i >= 0; i--) {
            SagaHistory entry = recorded.get(i);
            if (!entry.stepName().equals(stepName)) {
                continue;
            }
            if (entry.status() == StepStatus.COMPENSATED) {
                return false;
            }
            if (entry.status() == StepStatus.COMPLETED) {
                return true;
            }
        }
        return false;
    }

    private void updateHistory(SagaHistory updated) {
        lock.writeLock().lock();
        try {
            for (int i = history.size() - 1; i >= 0; i--) {
                if (history.get(i).sameEntry(updated)) {
                    history.set(i, updated);
                    return;
                }
            }
            history.add(updated);
        } finally {
            lock.writeLock().unlock();
        }
    }

    // caller holds the write lock
    private void changeStatus(SagaStatus newStatus) {
        SagaStatus old = status;
        status = newStatus;
        metrics.recordStatusChange(old, newStatus);
    }

    private void persist(String stage) {
        SagaPersistence target = persistence;
        if (target == null) {
            return;
        }
        try {
            target.save(this);
        } catch (SagaPersistenceException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new SagaPersistenceException(id, "failed to save saga state " + stage, e);
        }
    }

    private void publish(String eventType, Map<String, Object> metadata) {
        EventBus bus = eventBus;
        if (bus == null) {
            return;
        }
        try {
            bus.publish(DomainEvent.of(eventType, id, context.getCorrelationId(), metadata));
        } catch (RuntimeException e) {
            log.warn("Failed to publish {} for saga {}: {}", eventType, id, e.getMessage());
        }
    }

    private Instant now() {
        Instant instant = clock.instant().truncatedTo(ChronoUnit.MICROS);
        synchronized (timeLock) {
            if (instant.isAfter(lastTimestamp)) {
                lastTimestamp = instant;
            }
            return lastTimestamp;
        }
    }

    private Instant nextEntryStart() {
        Instant instant = now();
        synchronized (timeLock) {
            if (!instant.isAfter(lastEntryStart)) {
                instant = lastEntryStart.plus(1, ChronoUnit.MICROS);
            }
            lastEntryStart = instant;
            if (instant.isAfter(lastTimestamp)) {
                lastTimestamp = instant;
            }
            return instant;
        }
    }

    @Override
    public String toString() {
        return "SagaInstance[" + id + ", " + definition.getName() + ", " + getStatus() + "]";
    }

    private record Attempt(int attempt, Exception error) {
    }
}
