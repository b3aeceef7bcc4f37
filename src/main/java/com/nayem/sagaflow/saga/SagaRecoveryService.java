package com.nayem.sagaflow.saga;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Periodically resumes sagas that a crashed process left running or pending.
 * <p>
 * A saga is picked up when it is not executing in this process and its context has
 * not been touched for {@code staleAfter}. With a distributed lock only one node scans
 * per interval.
 * </p>
 */
public class SagaRecoveryService implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(SagaRecoveryService.class);
    private static final String LOCK_KEY = "recovery-leader";

    private final SagaOrchestrator orchestrator;
    private final SagaPersistence persistence;
    private final SagaRecoveryLock recoveryLock;
    private final SagaMetrics metrics;
    private final Duration interval;
    private final Duration staleAfter;
    private final Clock clock;
    private ScheduledExecutorService scheduler;

    public SagaRecoveryService(SagaOrchestrator orchestrator, SagaPersistence persistence,
            SagaRecoveryLock recoveryLock, SagaMetrics metrics, Duration interval, Duration staleAfter) {
        this(orchestrator, persistence, recoveryLock, metrics, interval, staleAfter, Clock.systemUTC());
    }

    SagaRecoveryService(SagaOrchestrator orchestrator, SagaPersistence persistence,
            SagaRecoveryLock recoveryLock, SagaMetrics metrics, Duration interval, Duration staleAfter,
            Clock clock) {
        this.orchestrator = orchestrator;
        this.persistence = persistence;
        this.recoveryLock = recoveryLock;
        this.metrics = metrics == null ? SagaMetrics.noOp() : metrics;
        this.interval = interval;
        this.staleAfter = staleAfter;
        this.clock = clock;
    }

    public synchronized void start() {
        if (scheduler != null) {
            return;
        }
        scheduler = Executors.newSingleThreadScheduledExecutor(SagaThreads.daemonFactory("sagaflow-recovery-"));
        scheduler.scheduleWithFixedDelay(this::runCycle, interval.toMillis(), interval.toMillis(),
                TimeUnit.MILLISECONDS);
        log.info("Started Saga recovery loop with interval {}", interval);
    }

    private void runCycle() {
        try {
            if (recoveryLock.acquireLock(LOCK_KEY, interval)) {
                recoverSagas();
            } else {
                log.debug("Skipping recovery, lock held by another instance");
            }
        } catch (Exception e) {
            log.error("Error in saga recovery loop", e);
        }
    }

    /**
     * Runs one recovery pass.
     *
     * @return ids of the sagas that were resubmitted
     */
    public List<String> recoverSagas() {
        List<SagaInstance> candidates = new ArrayList<>(persistence.loadAll(SagaStatus.RUNNING));
        candidates.addAll(persistence.loadAll(SagaStatus.PENDING));

        Instant threshold = clock.instant().minus(staleAfter);
        List<String> resumed = new ArrayList<>();
        for (SagaInstance saga : candidates) {
            if (orchestrator.isRunning(saga.getId())) {
                continue;
            }
            if (saga.getContext().metadata().updatedAt().isAfter(threshold)) {
                continue;
            }
            log.info("Recovering saga {} ({}), status {}", saga.getId(), saga.getDefinition().getName(),
                    saga.getStatus().value());
            try {
                orchestrator.resumeAsync(saga.getId());
                resumed.add(saga.getId());
            } catch (SagaException e) {
                log.error("Failed to recover saga {}", saga.getId(), e);
            }
        }
        metrics.recordRecoveredSagas(resumed.size());
        return resumed;
    }

    @Override
    public synchronized void close() {
        if (scheduler != null) {
            scheduler.shutdownNow();
            scheduler = null;
        }
        recoveryLock.releaseLock(LOCK_KEY);
    }
}
