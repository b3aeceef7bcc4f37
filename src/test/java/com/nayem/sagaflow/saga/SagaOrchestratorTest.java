package com.nayem.sagaflow.saga;

import com.nayem.sagaflow.events.DomainEvent;
import com.nayem.sagaflow.events.EventBus;
import com.nayem.sagaflow.events.InMemoryEventBus;
import com.nayem.sagaflow.events.SagaEventTypes;
import com.nayem.sagaflow.persistence.InMemorySagaPersistence;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class SagaOrchestratorTest {

    private SagaRegistry registry;
    private InMemorySagaPersistence persistence;
    private InMemoryEventBus eventBus;
    private List<DomainEvent> sagaEvents;
    private List<String> calls;
    private SagaOrchestrator orchestrator;

    @BeforeEach
    void setUp() {
        registry = new SagaRegistry();
        persistence = new InMemorySagaPersistence();
        eventBus = new InMemoryEventBus();
        sagaEvents = new CopyOnWriteArrayList<>();
        calls = new CopyOnWriteArrayList<>();
        eventBus.subscribe(EventBus.ALL_EVENTS, event -> {
            if (event.eventType().startsWith("Saga")) {
                sagaEvents.add(event);
            }
        });
        orchestrator = new SagaOrchestrator(registry, persistence, eventBus);
    }

    @AfterEach
    void tearDown() {
        orchestrator.close();
    }

    @Test
    void testExecuteAsyncCompletesWithFinalStatus() throws Exception {
        orchestrator.registerSaga("order", SagaBuilder.newSaga("order")
                .step(recording("a"))
                .step(recording("b"))
                .build());
        SagaInstance saga = orchestrator.createInstance("order", new SagaContext());

        SagaStatus status = orchestrator.executeAsync(saga).get(5, TimeUnit.SECONDS);

        assertEquals(SagaStatus.COMPLETED, status);
        assertEquals(SagaStatus.COMPLETED, orchestrator.getStatus(saga.getId()));
        assertFalse(orchestrator.isRunning(saga.getId()));
        assertEquals(List.of(SagaEventTypes.SAGA_STARTED, SagaEventTypes.SAGA_COMPLETED), eventTypes());
        DomainEvent completed = sagaEvents.get(1);
        assertEquals(saga.getId(), completed.getString(SagaEventTypes.SAGA_ID));
        assertEquals(2, completed.getLong(SagaEventTypes.STEPS_COMPLETED, -1));
        assertEquals(saga.getContext().getCorrelationId(), completed.correlationId());
    }

    @Test
    void testStepFailurePublishesSagaFailed() throws Exception {
        orchestrator.registerSaga("order", SagaBuilder.newSaga("order")
                .step(recording("a"))
                .step(failing("b"))
                .build());
        SagaInstance saga = orchestrator.createInstance("order", new SagaContext());

        SagaStatus status = orchestrator.executeAsync(saga).get(5, TimeUnit.SECONDS);

        assertEquals(SagaStatus.COMPENSATED, status);
        assertEquals(List.of(SagaEventTypes.SAGA_STARTED, SagaEventTypes.SAGA_FAILED), eventTypes());
        DomainEvent failed = sagaEvents.get(1);
        assertEquals("b", failed.getString(SagaEventTypes.FAILED_STEP));
        assertEquals("compensated", failed.getString(SagaEventTypes.STATUS));
    }

    @Test
    void testSynchronousExecuteRethrowsStepFailure() {
        orchestrator.registerSaga("order", SagaBuilder.newSaga("order").step(failing("a")).build());
        SagaInstance saga = orchestrator.createInstance("order", new SagaContext());

        assertThrows(SagaStepException.class, () -> orchestrator.execute(saga));
        assertFalse(orchestrator.isRunning(saga.getId()));
    }

    @Test
    void testStartSagaReturnsImmediately() throws Exception {
        CountDownLatch release = new CountDownLatch(1);
        orchestrator.registerSaga("order", SagaBuilder.newSaga("order")
                .step(FunctionalSagaStep.builder()
                        .name("wait")
                        .execute(ctx -> release.await(5, TimeUnit.SECONDS))
                        .build())
                .build());

        SagaInstance saga = orchestrator.startSaga("order", new SagaContext());

        assertTrue(orchestrator.isRunning(saga.getId()));
        assertTrue(orchestrator.runningSagaIds().contains(saga.getId()));
        release.countDown();
        awaitStatus(saga, SagaStatus.COMPLETED);
    }

    @Test
    void testCancelCompensatesCompletedSteps() throws Exception {
        CountDownLatch started = new CountDownLatch(1);
        orchestrator.registerSaga("order", SagaBuilder.newSaga("order")
                .step(recording("a"))
                .step(FunctionalSagaStep.builder()
                        .name("block")
                        .execute(ctx -> {
                            started.countDown();
                            Thread.sleep(10_000);
                        })
                        .build())
                .build());
        SagaInstance saga = orchestrator.createInstance("order", new SagaContext());
        CompletableFuture<SagaStatus> result = orchestrator.executeAsync(saga);
        assertTrue(started.await(5, TimeUnit.SECONDS));

        orchestrator.cancel(saga.getId());

        assertEquals(SagaStatus.COMPENSATED, result.get(5, TimeUnit.SECONDS));
        assertEquals(List.of("exec:a", "comp:a"), calls);
        assertFalse(orchestrator.isRunning(saga.getId()));
        SagaHistory blocked = saga.getHistory().get(1);
        assertEquals(StepStatus.FAILED, blocked.status());
        assertTrue(blocked.error().contains("cancelled"));
    }

    @Test
    void testCancelUnknownSagaFails() {
        assertThrows(SagaNotRunningException.class, () -> orchestrator.cancel("missing"));
    }

    @Test
    void testSagaTimeoutCancelsExecution() throws Exception {
        SimpleMeterRegistry meterRegistry = new SimpleMeterRegistry();
        SagaOrchestrator timed = new SagaOrchestrator(registry, persistence, eventBus,
                new SagaMetrics(meterRegistry), Duration.ofMillis(100), null, "test-saga-");
        try {
            timed.registerSaga("order", SagaBuilder.newSaga("order")
                    .step(recording("a"))
                    .step(FunctionalSagaStep.builder()
                            .name("slow")
                            .execute(ctx -> Thread.sleep(10_000))
                            .build())
                    .build());
            SagaInstance saga = timed.createInstance("order", new SagaContext());

            SagaStatus status = timed.executeAsync(saga).get(5, TimeUnit.SECONDS);

            assertEquals(SagaStatus.COMPENSATED, status);
            assertEquals(List.of("exec:a", "comp:a"), calls);
            assertEquals(1.0, meterRegistry.counter("sagaflow.saga.timeout.count").count());
        } finally {
            timed.close();
        }
    }

    @Test
    void testContextTimeoutOverridesOrchestratorDefault() throws Exception {
        orchestrator.registerSaga("order", SagaBuilder.newSaga("order")
                .step(FunctionalSagaStep.builder()
                        .name("slow")
                        .execute(ctx -> Thread.sleep(10_000))
                        .build())
                .build());
        SagaContext context = new SagaContext();
        context.setTimeout(Duration.ofMillis(100));
        SagaInstance saga = orchestrator.createInstance("order", context);

        assertEquals(SagaStatus.COMPENSATED, orchestrator.executeAsync(saga).get(5, TimeUnit.SECONDS));
    }

    @Test
    void testSagaCannotRunTwiceConcurrently() throws Exception {
        CountDownLatch release = new CountDownLatch(1);
        orchestrator.registerSaga("order", SagaBuilder.newSaga("order")
                .step(FunctionalSagaStep.builder()
                        .name("wait")
                        .execute(ctx -> release.await(5, TimeUnit.SECONDS))
                        .build())
                .build());
        SagaInstance saga = orchestrator.createInstance("order", new SagaContext());
        CompletableFuture<SagaStatus> first = orchestrator.executeAsync(saga);

        assertThrows(SagaStateException.class, () -> orchestrator.executeAsync(saga));

        release.countDown();
        assertEquals(SagaStatus.COMPLETED, first.get(5, TimeUnit.SECONDS));
    }

    @Test
    void testResumeRerunsPersistedSaga() {
        SagaDefinition definition = SagaBuilder.newSaga("order")
                .step(recording("a"))
                .step(recording("b"))
                .build();
        orchestrator.registerSaga("order", definition);
        SagaInstance crashed = SagaInstance.restore("crashed-1", definition, new SagaContext(), SagaStatus.RUNNING,
                "a", List.of(), null, null);
        persistence.save(crashed);

        orchestrator.resume("crashed-1");

        assertEquals(SagaStatus.COMPLETED, orchestrator.getStatus("crashed-1"));
        assertEquals(List.of("exec:a", "exec:b"), calls);
    }

    @Test
    void testResumeRejectsTerminalSaga() {
        SagaDefinition definition = SagaBuilder.newSaga("order").step(recording("a")).build();
        orchestrator.registerSaga("order", definition);
        persistence.save(SagaInstance.restore("done-1", definition, new SagaContext(), SagaStatus.COMPENSATED,
                "a", List.of(), null, null));

        assertThrows(SagaStateException.class, () -> orchestrator.resume("done-1"));
        assertTrue(calls.isEmpty());
        assertFalse(orchestrator.isRunning("done-1"));
    }

    @Test
    void testGetStatusOfUnknownSaga() {
        assertThrows(SagaPersistenceException.class, () -> orchestrator.getStatus("missing"));
    }

    @Test
    void testCreateInstanceOfUnknownDefinition() {
        assertThrows(SagaDefinitionNotFoundException.class,
                () -> orchestrator.createInstance("unknown", new SagaContext()));
    }

    @Test
    void testManualCompensationPublishesEvents() {
        orchestrator.registerSaga("order", SagaBuilder.newSaga("order")
                .step(recording("a"))
                .step(recording("b"))
                .build());
        SagaInstance saga = orchestrator.createInstance("order", new SagaContext());
        orchestrator.execute(saga);
        sagaEvents.clear();

        orchestrator.compensate(saga);

        assertEquals(SagaStatus.COMPENSATED, saga.getStatus());
        assertEquals(List.of(SagaEventTypes.SAGA_COMPENSATING, SagaEventTypes.SAGA_COMPENSATED), eventTypes());
        assertEquals("manual_compensation", sagaEvents.get(0).getString(SagaEventTypes.REASON));
        assertEquals(2, sagaEvents.get(1).getLong(SagaEventTypes.COMPENSATED_STEPS, -1));
    }

    @Test
    void testDefaultRetryPolicyAppliesToNewContexts() {
        AtomicInteger attempts = new AtomicInteger();
        registry.register(SagaBuilder.newSaga("order")
                .step(FunctionalSagaStep.builder()
                        .name("flaky")
                        .execute(ctx -> {
                            if (attempts.incrementAndGet() < 3) {
                                throw new IllegalStateException("transient");
                            }
                        })
                        .build())
                .build());
        SagaOrchestrator retrying = new SagaOrchestrator(registry, persistence, eventBus, SagaMetrics.noOp(),
                Duration.ZERO, RetryPolicy.exponentialBackoff(3, Duration.ZERO, 1.0), "retry-saga-");
        try {
            SagaInstance saga = retrying.createInstance("order", new SagaContext());

            retrying.execute(saga);

            assertEquals(SagaStatus.COMPLETED, saga.getStatus());
            assertEquals(3, attempts.get());
        } finally {
            retrying.close();
        }
    }

    @Test
    void testCancelStopsRetriesOfStepThatSwallowsInterrupt() throws Exception {
        CountDownLatch started = new CountDownLatch(1);
        AtomicInteger attempts = new AtomicInteger();
        orchestrator.registerSaga("order", SagaBuilder.newSaga("order")
                .step(recording("a"))
                .step(FunctionalSagaStep.builder()
                        .name("flaky")
                        .retryPolicy(RetryPolicy.exponentialBackoff(3, Duration.ofMillis(10), 1.0))
                        .execute(ctx -> {
                            if (attempts.incrementAndGet() == 1) {
                                started.countDown();
                                try {
                                    Thread.sleep(10_000);
                                } catch (InterruptedException e) {
                                    throw new RuntimeException(e);
                                }
                            }
                        })
                        .build())
                .build());
        SagaInstance saga = orchestrator.createInstance("order", new SagaContext());
        CompletableFuture<SagaStatus> result = orchestrator.executeAsync(saga);
        assertTrue(started.await(5, TimeUnit.SECONDS));

        orchestrator.cancel(saga.getId());

        assertEquals(SagaStatus.COMPENSATED, result.get(5, TimeUnit.SECONDS));
        assertEquals(1, attempts.get());
        assertEquals(List.of("exec:a", "comp:a"), calls);
        SagaHistory flaky = saga.getHistory().get(1);
        assertEquals("flaky", flaky.stepName());
        assertEquals(StepStatus.FAILED, flaky.status());
        assertTrue(flaky.error().contains("cancelled"));
    }

    @Test
    void testCancelPreventsNextStepAfterInterruptIsSwallowed() throws Exception {
        CountDownLatch started = new CountDownLatch(1);
        orchestrator.registerSaga("order", SagaBuilder.newSaga("order")
                .step(FunctionalSagaStep.builder()
                        .name("a")
                        .execute(ctx -> {
                            started.countDown();
                            try {
                                Thread.sleep(10_000);
                            } catch (InterruptedException e) {
                                calls.add("interrupted:a");
                            }
                        })
                        .compensate(ctx -> calls.add("comp:a"))
                        .build())
                .step(recording("b"))
                .build());
        SagaInstance saga = orchestrator.createInstance("order", new SagaContext());
        CompletableFuture<SagaStatus> result = orchestrator.executeAsync(saga);
        assertTrue(started.await(5, TimeUnit.SECONDS));

        orchestrator.cancel(saga.getId());

        assertEquals(SagaStatus.COMPENSATED, result.get(5, TimeUnit.SECONDS));
        assertEquals(List.of("interrupted:a", "comp:a"), calls);
    }

    @Test
    void testResumeOfExecutingSagaLeavesItRunning() throws Exception {
        CountDownLatch started = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        orchestrator.registerSaga("order", SagaBuilder.newSaga("order")
                .step(FunctionalSagaStep.builder()
                        .name("wait")
                        .execute(ctx -> {
                            started.countDown();
                            release.await(5, TimeUnit.SECONDS);
                        })
                        .build())
                .build());
        SagaInstance saga = orchestrator.createInstance("order", new SagaContext());
        CompletableFuture<SagaStatus> result = orchestrator.executeAsync(saga);
        assertTrue(started.await(5, TimeUnit.SECONDS));

        assertThrows(SagaStateException.class, () -> orchestrator.resume(saga.getId()));
        assertThrows(SagaStateException.class, () -> orchestrator.resumeAsync(saga.getId()));

        assertEquals(SagaStatus.RUNNING, saga.getStatus());
        assertEquals(SagaStatus.RUNNING, orchestrator.getStatus(saga.getId()));
        assertTrue(orchestrator.isRunning(saga.getId()));
        release.countDown();
        assertEquals(SagaStatus.COMPLETED, result.get(5, TimeUnit.SECONDS));
    }

    @Test
    void testExecutingFinishedSagaPublishesAndSavesNothing() {
        AtomicInteger saves = new AtomicInteger();
        InMemorySagaPersistence counting = new InMemorySagaPersistence() {
            @Override
            public void save(SagaInstance saga) {
                saves.incrementAndGet();
                super.save(saga);
            }
        };
        SagaOrchestrator local = new SagaOrchestrator(registry, counting, eventBus);
        try {
            local.registerSaga("order", SagaBuilder.newSaga("order").step(recording("a")).build());
            SagaInstance saga = local.createInstance("order", new SagaContext());
            local.execute(saga);
            sagaEvents.clear();
            saves.set(0);

            assertThrows(SagaStateException.class, () -> local.execute(saga));
            ExecutionException async = assertThrows(ExecutionException.class,
                    () -> local.executeAsync(saga).get(5, TimeUnit.SECONDS));

            assertInstanceOf(SagaStateException.class, async.getCause());
            assertTrue(sagaEvents.isEmpty());
            assertEquals(0, saves.get());
            assertFalse(local.isRunning(saga.getId()));
            assertEquals(SagaStatus.COMPLETED, saga.getStatus());
        } finally {
            local.close();
        }
    }

    private List<String> eventTypes() {
        return sagaEvents.stream().map(DomainEvent::eventType).toList();
    }

    private void awaitStatus(SagaInstance saga, SagaStatus expected) throws InterruptedException {
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
        while (saga.getStatus() != expected && System.nanoTime() < deadline) {
            Thread.sleep(10);
        }
        assertEquals(expected, saga.getStatus());
    }

    private SagaStep recording(String name) {
        return FunctionalSagaStep.builder()
                .name(name)
                .execute(ctx -> calls.add("exec:" + name))
                .compensate(ctx -> calls.add("comp:" + name))
                .build();
    }

    private SagaStep failing(String name) {
        return FunctionalSagaStep.builder()
                .name(name)
                .execute(ctx -> {
                    throw new IllegalStateException(name + " exploded");
                })
                .build();
    }
}
