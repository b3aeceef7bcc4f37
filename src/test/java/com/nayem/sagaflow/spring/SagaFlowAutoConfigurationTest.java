package com.nayem.sagaflow.spring;

import com.nayem.sagaflow.events.EventBus;
import com.nayem.sagaflow.events.InMemoryEventBus;
import com.nayem.sagaflow.eventsourcing.EventStore;
import com.nayem.sagaflow.eventsourcing.InMemoryEventStore;
import com.nayem.sagaflow.eventsourcing.InMemorySnapshotStore;
import com.nayem.sagaflow.eventsourcing.SnapshotStore;
import com.nayem.sagaflow.persistence.EventSourcedSagaPersistence;
import com.nayem.sagaflow.persistence.InMemorySagaPersistence;
import com.nayem.sagaflow.persistence.JdbcSagaPersistence;
import com.nayem.sagaflow.saga.FunctionalSagaStep;
import com.nayem.sagaflow.saga.NoOpSagaRecoveryLock;
import com.nayem.sagaflow.saga.SagaBuilder;
import com.nayem.sagaflow.saga.SagaContext;
import com.nayem.sagaflow.saga.SagaDefinition;
import com.nayem.sagaflow.saga.SagaInstance;
import com.nayem.sagaflow.saga.SagaMetrics;
import com.nayem.sagaflow.saga.SagaOrchestrator;
import com.nayem.sagaflow.saga.SagaPersistence;
import com.nayem.sagaflow.saga.SagaRecoveryLock;
import com.nayem.sagaflow.saga.SagaRecoveryService;
import com.nayem.sagaflow.saga.SagaRegistry;
import com.nayem.sagaflow.saga.SagaStatus;
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.embedded.EmbeddedDatabaseBuilder;
import org.springframework.jdbc.datasource.embedded.EmbeddedDatabaseType;

import javax.sql.DataSource;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;

class SagaFlowAutoConfigurationTest {

    private final ApplicationContextRunner contextRunner = new ApplicationContextRunner()
            .withConfiguration(AutoConfigurations.of(SagaFlowAutoConfiguration.class))
            .withBean("orderSaga", SagaDefinition.class, SagaFlowAutoConfigurationTest::orderSaga);

    @Test
    void shouldCreateInMemoryEngineByDefault() {
        contextRunner.run(context -> {
            assertThat(context).hasSingleBean(SagaOrchestrator.class);
            assertThat(context).hasSingleBean(SagaMetrics.class);
            assertThat(context.getBean(EventBus.class)).isInstanceOf(InMemoryEventBus.class);
            assertThat(context.getBean(SagaPersistence.class)).isInstanceOf(InMemorySagaPersistence.class);
            assertThat(context.getBean(SagaRecoveryLock.class)).isInstanceOf(NoOpSagaRecoveryLock.class);
            assertThat(context).doesNotHaveBean(EventStore.class);
            assertThat(context).doesNotHaveBean(SagaRecoveryService.class);
            assertThat(context.getBean(SagaRegistry.class).find("order")).isPresent();
        });
    }

    @Test
    void shouldRunRegisteredSagaThroughOrchestrator() {
        contextRunner.run(context -> {
            SagaOrchestrator orchestrator = context.getBean(SagaOrchestrator.class);
            SagaInstance saga = orchestrator.createInstance("order", new SagaContext());

            orchestrator.execute(saga);

            assertThat(orchestrator.getStatus(saga.getId())).isEqualTo(SagaStatus.COMPLETED);
        });
    }

    @Test
    void shouldBackOffWhenDisabled() {
        contextRunner.withPropertyValues("sagaflow.enabled=false")
                .run(context -> assertThat(context).doesNotHaveBean(SagaOrchestrator.class));
    }

    @Test
    void shouldWireEventSourcedPersistence() {
        contextRunner.withPropertyValues("sagaflow.persistence.store=event-store",
                        "sagaflow.event-store.max-events-per-stream=500")
                .run(context -> {
                    assertThat(context.getBean(EventStore.class)).isInstanceOf(InMemoryEventStore.class);
                    assertThat(context.getBean(SnapshotStore.class)).isInstanceOf(InMemorySnapshotStore.class);
                    assertThat(context.getBean(SagaPersistence.class))
                            .isInstanceOf(EventSourcedSagaPersistence.class);
                });
    }

    @Test
    void shouldWireJdbcPersistenceAndCreateTables() {
        contextRunner.withPropertyValues("sagaflow.persistence.store=jdbc")
                .withBean(DataSource.class, () -> new EmbeddedDatabaseBuilder()
                        .setType(EmbeddedDatabaseType.H2)
                        .setName("sagaflow-" + UUID.randomUUID())
                        .build())
                .run(context -> {
                    assertThat(context.getBean(SagaPersistence.class)).isInstanceOf(JdbcSagaPersistence.class);
                    JdbcTemplate jdbcTemplate = new JdbcTemplate(context.getBean(DataSource.class));
                    assertThat(jdbcTemplate.queryForObject("SELECT COUNT(*) FROM saga_instances", Integer.class))
                            .isZero();
                });
    }

    @Test
    void shouldFailJdbcPersistenceWithoutDataSource() {
        contextRunner.withPropertyValues("sagaflow.persistence.store=jdbc")
                .run(context -> {
                    assertThat(context).hasFailed();
                    assertThat(context.getStartupFailure())
                            .rootCause()
                            .isInstanceOf(IllegalStateException.class)
                            .hasMessageContaining("DataSource");
                });
    }

    @Test
    void shouldRequireRedisForDistributedLocking() {
        contextRunner.withPropertyValues("sagaflow.recovery.distributed-locking=true")
                .run(context -> {
                    assertThat(context).hasFailed();
                    assertThat(context.getStartupFailure())
                            .rootCause()
                            .isInstanceOf(IllegalStateException.class)
                            .hasMessage("Redis is required for Distributed Saga Recovery Lock");
                });
    }

    @Test
    void shouldStartRecoveryWhenEnabled() {
        contextRunner.withPropertyValues("sagaflow.recovery.enabled=true", "sagaflow.recovery.interval=60")
                .run(context -> assertThat(context).hasSingleBean(SagaRecoveryService.class));
    }

    @Test
    void shouldKeepUserProvidedPersistence() {
        InMemorySagaPersistence custom = new InMemorySagaPersistence();
        contextRunner.withBean(SagaPersistence.class, () -> custom)
                .run(context -> assertThat(context.getBean(SagaPersistence.class)).isSameAs(custom));
    }

    private static SagaDefinition orderSaga() {
        return SagaBuilder.newSaga("order")
                .step(FunctionalSagaStep.builder().name("reserve").execute(ctx -> { }).build())
                .build();
    }
}
