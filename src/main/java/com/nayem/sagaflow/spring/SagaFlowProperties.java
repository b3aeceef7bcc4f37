package com.nayem.sagaflow.spring;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.convert.DurationUnit;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.time.temporal.ChronoUnit;

/**
 * Configuration properties for the SagaFlow orchestration engine.
 * <p>
 * These properties can be configured in {@code application.yml} under the
 * {@code sagaflow} prefix.
 * </p>
 */
@ConfigurationProperties(prefix = "sagaflow")
@Validated
public class SagaFlowProperties {

    /**
     * Whether the saga engine beans are created at all.
     */
    private boolean enabled = true;

    @Valid
    private Orchestrator orchestrator = new Orchestrator();

    /**
     * Saga-wide retry policy applied to sagas whose context carries none.
     */
    @Valid
    private Retry retry = new Retry();

    @Valid
    private Persistence persistence = new Persistence();

    @Valid
    private EventStore eventStore = new EventStore();

    /**
     * Crash recovery of sagas left running by a stopped process.
     */
    @Valid
    private Recovery recovery = new Recovery();

    /** @return whether the saga engine is enabled */
    public boolean isEnabled() {
        return enabled;
    }

    /** @param enabled whether the saga engine is enabled */
    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    /** @return the orchestrator configuration */
    public Orchestrator getOrchestrator() {
        return orchestrator;
    }

    /** @param orchestrator the orchestrator configuration */
    public void setOrchestrator(Orchestrator orchestrator) {
        this.orchestrator = orchestrator;
    }

    /** @return the default retry configuration */
    public Retry getRetry() {
        return retry;
    }

    /** @param retry the default retry configuration */
    public void setRetry(Retry retry) {
        this.retry = retry;
    }

    /** @return the persistence configuration */
    public Persistence getPersistence() {
        return persistence;
    }

    /** @param persistence the persistence configuration */
    public void setPersistence(Persistence persistence) {
        this.persistence = persistence;
    }

    /** @return the event store configuration */
    public EventStore getEventStore() {
        return eventStore;
    }

    /** @param eventStore the event store configuration */
    public void setEventStore(EventStore eventStore) {
        this.eventStore = eventStore;
    }

    /** @return the recovery configuration */
    public Recovery getRecovery() {
        return recovery;
    }

    /** @param recovery the recovery configuration */
    public void setRecovery(Recovery recovery) {
        this.recovery = recovery;
    }

    public static class Orchestrator {
        /**
         * Prefix for the names of the threads running asynchronous sagas.
         */
        @NotBlank
        private String threadNamePrefix = "sagaflow-saga-";

        /**
         * Default deadline for a whole saga; a saga still running after it is cancelled.
         * Zero disables the deadline.
         */
        @DurationUnit(ChronoUnit.SECONDS)
        private Duration sagaTimeout = Duration.ZERO;

        /** @return the thread name prefix */
        public String getThreadNamePrefix() {
            return threadNamePrefix;
        }

        /** @param threadNamePrefix the thread name prefix */
        public void setThreadNamePrefix(String threadNamePrefix) {
            this.threadNamePrefix = threadNamePrefix;
        }

        /** @return the default saga deadline */
        public Duration getSagaTimeout() {
            return sagaTimeout;
        }

        /** @param sagaTimeout the default saga deadline */
        public void setSagaTimeout(Duration sagaTimeout) {
            this.sagaTimeout = sagaTimeout;
        }
    }

    /**
     * Retry configuration for failed saga steps.
     * <p>
     * With the default of a single attempt no saga-wide policy is installed and the
     * definition's own default applies.
     * </p>
     */
    public static class Retry {
        /**
         * Attempts per step, including the first one.
         */
        @Min(1)
        @Max(100)
        private int maxAttempts = 1;

        /**
         * Delay before the first retry.
         */
        @DurationUnit(ChronoUnit.MILLIS)
        private Duration initialDelay = Duration.ofSeconds(1);

        /**
         * Factor applied to the linearly growing delay.
         */
        @DecimalMin("1.0")
        private double backoffMultiplier = 1.0;

        /** @return the maximum attempts per step */
        public int getMaxAttempts() {
            return maxAttempts;
        }

        /** @param maxAttempts the maximum attempts per step */
        public void setMaxAttempts(int maxAttempts) {
            this.maxAttempts = maxAttempts;
        }

        /** @return the delay before the first retry */
        public Duration getInitialDelay() {
            return initialDelay;
        }

        /** @param initialDelay the delay before the first retry */
        public void setInitialDelay(Duration initialDelay) {
            this.initialDelay = initialDelay;
        }

        /** @return the backoff multiplier */
        public double getBackoffMultiplier() {
            return backoffMultiplier;
        }

        /** @param backoffMultiplier the backoff multiplier */
        public void setBackoffMultiplier(double backoffMultiplier) {
            this.backoffMultiplier = backoffMultiplier;
        }
    }

    public static class Persistence {
        /**
         * Saga state store: 'memory' (development), 'event-store' or 'jdbc'.
         */
        private String store = "memory"; // memory, event-store, jdbc

        /**
         * History entries between two snapshot state refreshes of the event-sourced store.
         */
        @Min(1)
        private int snapshotFrequency = 10;

        /**
         * Whether the JDBC store creates its tables on startup.
         */
        private boolean initializeSchema = true;

        /** @return the saga state store */
        public String getStore() {
            return store;
        }

        /** @param store the saga state store */
        public void setStore(String store) {
            this.store = store;
        }

        /** @return the snapshot frequency */
        public int getSnapshotFrequency() {
            return snapshotFrequency;
        }

        /** @param snapshotFrequency the snapshot frequency */
        public void setSnapshotFrequency(int snapshotFrequency) {
            this.snapshotFrequency = snapshotFrequency;
        }

        /** @return whether the JDBC schema is created on startup */
        public boolean isInitializeSchema() {
            return initializeSchema;
        }

        /** @param initializeSchema whether the JDBC schema is created on startup */
        public void setInitializeSchema(boolean initializeSchema) {
            this.initializeSchema = initializeSchema;
        }
    }

    /**
     * Event and snapshot storage used by the 'event-store' persistence.
     */
    public static class EventStore {
        /**
         * Storage backend: 'memory' (development) or 'redis' (production).
         */
        private String backend = "memory"; // memory, redis

        /**
         * Stream length limit of the in-memory backend. Set to 0 for unbounded.
         */
        @Min(0)
        private int maxEventsPerStream = 10_000;

        /** @return the storage backend */
        public String getBackend() {
            return backend;
        }

        /** @param backend the storage backend */
        public void setBackend(String backend) {
            this.backend = backend;
        }

        /** @return the in-memory stream length limit */
        public int getMaxEventsPerStream() {
            return maxEventsPerStream;
        }

        /** @param maxEventsPerStream the in-memory stream length limit */
        public void setMaxEventsPerStream(int maxEventsPerStream) {
            this.maxEventsPerStream = maxEventsPerStream;
        }
    }

    public static class Recovery {
        /**
         * Whether persisted running sagas are periodically resumed.
         */
        private boolean enabled = false;

        /**
         * How frequently to scan for interrupted sagas.
         */
        @DurationUnit(ChronoUnit.SECONDS)
        private Duration interval = Duration.ofSeconds(30);

        /**
         * How long a saga must have been idle before it counts as interrupted.
         */
        @DurationUnit(ChronoUnit.SECONDS)
        private Duration staleAfter = Duration.ofMinutes(1);

        /**
         * Whether to use distributed locking for recovery in clustered environments.
         */
        private boolean distributedLocking = false;

        /** @return whether crash recovery is enabled */
        public boolean isEnabled() {
            return enabled;
        }

        /** @param enabled whether crash recovery is enabled */
        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        /** @return the recovery scan interval */
        public Duration getInterval() {
            return interval;
        }

        /** @param interval the recovery scan interval */
        public void setInterval(Duration interval) {
            this.interval = interval;
        }

        /** @return the idle time after which a saga is recovered */
        public Duration getStaleAfter() {
            return staleAfter;
        }

        /** @param staleAfter the idle time after which a saga is recovered */
        public void setStaleAfter(Duration staleAfter) {
            this.staleAfter = staleAfter;
        }

        /** @return whether distributed locking is enabled */
        public boolean isDistributedLocking() {
            return distributedLocking;
        }

        /** @param distributedLocking whether distributed locking is enabled */
        public void setDistributedLocking(boolean distributedLocking) {
            this.distributedLocking = distributedLocking;
        }
    }
}
