package com.nayem.sagaflow.spring;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.nayem.sagaflow.events.EventBus;
import com.nayem.sagaflow.events.InMemoryEventBus;
import com.nayem.sagaflow.eventsourcing.EventJson;
import com.nayem.sagaflow.eventsourcing.EventStore;
import com.nayem.sagaflow.eventsourcing.InMemoryEventStore;
import com.nayem.sagaflow.eventsourcing.InMemorySnapshotStore;
import com.nayem.sagaflow.eventsourcing.RedisEventStore;
import com.nayem.sagaflow.eventsourcing.RedisSnapshotStore;
import com.nayem.sagaflow.eventsourcing.SnapshotStore;
import com.nayem.sagaflow.persistence.EventSourcedSagaPersistence;
import com.nayem.sagaflow.persistence.InMemorySagaPersistence;
import com.nayem.sagaflow.persistence.JdbcSagaPersistence;
import com.nayem.sagaflow.saga.NoOpSagaRecoveryLock;
import com.nayem.sagaflow.saga.RedisSagaRecoveryLock;
import com.nayem.sagaflow.saga.RetryPolicy;
import com.nayem.sagaflow.saga.SagaDefinition;
import com.nayem.sagaflow.saga.SagaMetrics;
import com.nayem.sagaflow.saga.SagaOrchestrator;
import com.nayem.sagaflow.saga.SagaPersistence;
import com.nayem.sagaflow.saga.SagaRecoveryLock;
import com.nayem.sagaflow.saga.SagaRecoveryService;
import com.nayem.sagaflow.saga.SagaRegistry;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.core.StringRedisTemplate;

import javax.sql.DataSource;
import java.util.Locale;

@Configuration
@EnableConfigurationProperties(SagaFlowProperties.class)
@ConditionalOnProperty(name = "sagaflow.enabled", havingValue = "true", matchIfMissing = true)
public class SagaFlowAutoConfiguration {

    private static final Logger log = LoggerFactory.getLogger(SagaFlowAutoConfiguration.class);

    /**
     * Registry holding every {@link SagaDefinition} bean under its own name.
     */
    @Bean
    @ConditionalOnMissingBean
    public SagaRegistry sagaRegistry(ObjectProvider<SagaDefinition> definitions) {
        SagaRegistry registry = new SagaRegistry();
        definitions.orderedStream().forEach(registry::register);
        return registry;
    }

    @Bean
    @ConditionalOnMissingBean
    public EventBus sagaEventBus() {
        return new InMemoryEventBus();
    }

    @Bean
    @ConditionalOnMissingBean
    public SagaMetrics sagaMetrics(ObjectProvider<MeterRegistry> registryProvider) {
        return new SagaMetrics(registryProvider.getIfAvailable());
    }

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnProperty(name = "sagaflow.persistence.store", havingValue = "event-store")
    public EventStore sagaEventStore(
            SagaFlowProperties properties,
            ObjectProvider<StringRedisTemplate> redisTemplateProvider,
            ObjectProvider<ObjectMapper> objectMapperProvider) {

        String backend = properties.getEventStore().getBackend();
        return switch (backend.toLowerCase(Locale.ROOT)) {
            case "memory" -> new InMemoryEventStore(properties.getEventStore().getMaxEventsPerStream());
            case "redis" -> new RedisEventStore(requireRedis(redisTemplateProvider, "Redis Event Store"),
                    objectMapperProvider.getIfAvailable(EventJson::newObjectMapper));
            default -> {
                log.warn("Unknown event store backend '{}', falling back to memory", backend);
                yield new InMemoryEventStore(properties.getEventStore().getMaxEventsPerStream());
            }
        };
    }

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnProperty(name = "sagaflow.persistence.store", havingValue = "event-store")
    public SnapshotStore sagaSnapshotStore(
            SagaFlowProperties properties,
            ObjectProvider<StringRedisTemplate> redisTemplateProvider,
            ObjectProvider<ObjectMapper> objectMapperProvider) {

        if ("redis".equalsIgnoreCase(properties.getEventStore().getBackend())) {
            return new RedisSnapshotStore(requireRedis(redisTemplateProvider, "Redis Snapshot Store"),
                    objectMapperProvider.getIfAvailable(EventJson::newObjectMapper));
        }
        return new InMemorySnapshotStore();
    }

    @Bean
    @ConditionalOnMissingBean
    public SagaPersistence sagaPersistence(
            SagaFlowProperties properties,
            SagaRegistry registry,
            ObjectProvider<EventStore> eventStoreProvider,
            ObjectProvider<SnapshotStore> snapshotStoreProvider,
            ObjectProvider<DataSource> dataSourceProvider,
            ObjectProvider<ObjectMapper> objectMapperProvider) {

        String store = properties.getPersistence().getStore();
        return switch (store.toLowerCase(Locale.ROOT)) {
            case "memory" -> new InMemorySagaPersistence();
            case "event-store" -> {
                EventStore eventStore = eventStoreProvider.getIfAvailable();
                if (eventStore == null) {
                    throw new IllegalStateException("An EventStore is required for event-sourced saga persistence");
                }
                yield new EventSourcedSagaPersistence(
                        eventStore,
                        snapshotStoreProvider.getIfAvailable(),
                        registry,
                        objectMapperProvider.getIfAvailable(EventJson::newObjectMapper),
                        properties.getPersistence().getSnapshotFrequency());
            }
            case "jdbc" -> {
                DataSource dataSource = dataSourceProvider.getIfAvailable();
                if (dataSource == null) {
                    throw new IllegalStateException("A DataSource is required for JDBC saga persistence");
                }
                JdbcSagaPersistence persistence = new JdbcSagaPersistence(dataSource, registry,
                        objectMapperProvider.getIfAvailable(EventJson::newObjectMapper));
                if (properties.getPersistence().isInitializeSchema()) {
                    persistence.initializeSchema();
                }
                yield persistence;
            }
            default -> {
                log.warn("Unknown saga persistence store '{}', falling back to memory", store);
                yield new InMemorySagaPersistence();
            }
        };
    }

    @Bean
    @ConditionalOnMissingBean
    public SagaRecoveryLock sagaRecoveryLock(
            SagaFlowProperties properties,
            ObjectProvider<StringRedisTemplate> redisTemplateProvider) {

        if (properties.getRecovery().isDistributedLocking()) {
            return new RedisSagaRecoveryLock(requireRedis(redisTemplateProvider, "Distributed Saga Recovery Lock"));
        }
        return new NoOpSagaRecoveryLock();
    }

    @Bean(destroyMethod = "close")
    @ConditionalOnMissingBean
    public SagaOrchestrator sagaOrchestrator(
            SagaRegistry registry,
            SagaPersistence persistence,
            EventBus eventBus,
            SagaMetrics metrics,
            SagaFlowProperties properties) {

        SagaFlowProperties.Retry retry = properties.getRetry();
        RetryPolicy defaultRetryPolicy = retry.getMaxAttempts() > 1
                ? RetryPolicy.exponentialBackoff(retry.getMaxAttempts(), retry.getInitialDelay(),
                        retry.getBackoffMultiplier())
                : null;

        return new SagaOrchestrator(
                registry,
                persistence,
                eventBus,
                metrics,
                properties.getOrchestrator().getSagaTimeout(),
                defaultRetryPolicy,
                properties.getOrchestrator().getThreadNamePrefix());
    }

    @Bean(initMethod = "start", destroyMethod = "close")
    @ConditionalOnMissingBean
    @ConditionalOnProperty(name = "sagaflow.recovery.enabled", havingValue = "true")
    public SagaRecoveryService sagaRecoveryService(
            SagaOrchestrator orchestrator,
            SagaPersistence persistence,
            SagaRecoveryLock recoveryLock,
            SagaMetrics metrics,
            SagaFlowProperties properties) {

        return new SagaRecoveryService(
                orchestrator,
                persistence,
                recoveryLock,
                metrics,
                properties.getRecovery().getInterval(),
                properties.getRecovery().getStaleAfter());
    }

    private static StringRedisTemplate requireRedis(ObjectProvider<StringRedisTemplate> provider, String feature) {
        StringRedisTemplate redis = provider.getIfAvailable();
        if (redis == null) {
            throw new IllegalStateException("Redis is required for " + feature);
        }
        return redis;
    }
}
