package com.nayem.sagaflow.persistence;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.nayem.sagaflow.events.DomainEvent;
import com.nayem.sagaflow.events.SagaEventTypes;
import com.nayem.sagaflow.eventsourcing.EventJson;
import com.nayem.sagaflow.eventsourcing.EventStore;
import com.nayem.sagaflow.eventsourcing.EventStoreException;
import com.nayem.sagaflow.eventsourcing.Snapshot;
import com.nayem.sagaflow.eventsourcing.SnapshotStore;
import com.nayem.sagaflow.eventsourcing.StoredEvent;
import com.nayem.sagaflow.saga.SagaContext;
import com.nayem.sagaflow.saga.SagaDefinition;
import com.nayem.sagaflow.saga.SagaException;
import com.nayem.sagaflow.saga.SagaHistory;
import com.nayem.sagaflow.saga.SagaInstance;
import com.nayem.sagaflow.saga.SagaPersistence;
import com.nayem.sagaflow.saga.SagaPersistenceException;
import com.nayem.sagaflow.saga.SagaRegistry;
import com.nayem.sagaflow.saga.SagaStatus;
import com.nayem.sagaflow.saga.StepEvents;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * {@link SagaPersistence} on top of an {@link EventStore}, with optional snapshots.
 * <p>
 * Every save appends one batch to the saga's stream: a {@code SagaStateChanged} event
 * carrying status, current step and context; one Step* event per history entry recorded
 * since the previous save; and a closing {@code SagaStateCheckpoint} with the stream version
 * and history count after the batch. A saga with history H saved M times therefore has
 * H + 2M events.
 * </p>
 * <p>
 * To find where the previous save stopped, the snapshot metadata is consulted first, then
 * the latest checkpoint in the stream, then the latest {@code SagaStateChanged} found by
 * type, and only then every step event is counted. A known position is refined by reading
 * just the events written after it.
 * </p>
 * <p>
 * The snapshot state is rewritten every {@code snapshotFrequency} history entries; its
 * bookkeeping metadata on every save.
 * </p>
 */
public class EventSourcedSagaPersistence implements SagaPersistence {

    private static final Logger log = LoggerFactory.getLogger(EventSourcedSagaPersistence.class);

    public static final int DEFAULT_SNAPSHOT_FREQUENCY = 10;
    static final String AGGREGATE_TYPE = "saga";
    static final String STATE_VERSION = "state_version";

    private final EventStore eventStore;
    private final SnapshotStore snapshotStore;
    private final SagaRegistry registry;
    private final ObjectMapper objectMapper;
    private final int snapshotFrequency;

    public EventSourcedSagaPersistence(EventStore eventStore, SnapshotStore snapshotStore, SagaRegistry registry) {
        this(eventStore, snapshotStore, registry, EventJson.newObjectMapper(), DEFAULT_SNAPSHOT_FREQUENCY);
    }

    /**
     * @param snapshotStore     May be {@code null}, every load then replays the full stream
     * @param snapshotFrequency History entries between two snapshot state refreshes, at least 1
     */
    public EventSourcedSagaPersistence(EventStore eventStore, SnapshotStore snapshotStore, SagaRegistry registry,
            ObjectMapper objectMapper, int snapshotFrequency) {
        if (snapshotFrequency < 1) {
            throw new IllegalArgumentException("snapshotFrequency must be >= 1");
        }
        this.eventStore = eventStore;
        this.snapshotStore = snapshotStore;
        this.registry = registry;
        this.objectMapper = EventJson.configure(objectMapper);
        this.snapshotFrequency = snapshotFrequency;
    }

    @Override
    public void save(SagaInstance saga) {
        String sagaId = saga.getId();
        List<SagaHistory> history = saga.getHistory();
        StreamPosition previous = resolvePosition(sagaId);
        int from = Math.min(previous.savedHistoryCount(), history.size());
        String correlationId = saga.getContext().getCorrelationId();

        List<DomainEvent> batch = new ArrayList<>();
        batch.add(DomainEvent.of(SagaEventTypes.SAGA_STATE_CHANGED, sagaId, correlationId,
                stateChangedMetadata(saga, previous)));
        for (SagaHistory entry : history.subList(from, history.size())) {
            batch.add(DomainEvent.of(StepEvents.eventTypeFor(entry.status()), sagaId, correlationId,
                    StepEvents.toMetadata(entry)));
        }
        long newVersion = previous.version() + batch.size() + 1;
        Map<String, Object> checkpoint = new LinkedHashMap<>();
        checkpoint.put(SagaEventTypes.LAST_SAVED_VERSION, newVersion);
        checkpoint.put(SagaEventTypes.SAVED_HISTORY_COUNT, history.size());
        batch.add(DomainEvent.of(SagaEventTypes.SAGA_STATE_CHECKPOINT, sagaId, correlationId, checkpoint));

        try {
            eventStore.appendEvents(sagaId, previous.version(), batch);
        } catch (EventStoreException e) {
            throw new SagaPersistenceException(sagaId, "failed to append events for saga " + sagaId, e);
        }
        log.debug("Saga {} saved at version {} ({} new history entries)", sagaId, newVersion,
                history.size() - from);

        if (snapshotStore != null) {
            updateSnapshot(saga, previous.savedHistoryCount(), history.size(), newVersion);
        }
    }

    private Map<String, Object> stateChangedMetadata(SagaInstance saga, StreamPosition previous) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put(SagaEventTypes.STATUS, saga.getStatus().value());
        metadata.put(SagaEventTypes.STEP, saga.getCurrentStep() == null ? "" : saga.getCurrentStep());
        metadata.put(SagaEventTypes.CONTEXT, saga.getContext().toMap());
        metadata.put(SagaEventTypes.DEFINITION_NAME, saga.getDefinition().getName());
        metadata.put(SagaEventTypes.SAVED_HISTORY_COUNT, previous.savedHistoryCount());
        metadata.put(SagaEventTypes.LAST_SAVED_VERSION, previous.version());
        if (saga.getStartedAt() != null) {
            metadata.put(SagaEventTypes.STARTED_AT, saga.getStartedAt().toString());
        }
        if (saga.getCompletedAt() != null) {
            metadata.put(SagaEventTypes.COMPLETED_AT, saga.getCompletedAt().toString());
        }
        return metadata;
    }

    /**
     * Stream version and saved history count as left by the previous save.
     */
    StreamPosition resolvePosition(String sagaId) {
        try {
            Optional<StreamPosition> fromSnapshot = positionFromSnapshot(sagaId);
            if (fromSnapshot.isPresent()) {
                return refine(sagaId, fromSnapshot.get());
            }
            List<StoredEvent> stream = eventStore.getEvents(sagaId, 1);
            if (stream.isEmpty()) {
                return new StreamPosition(0, 0);
            }
            Optional<StreamPosition> fromCheckpoint = positionFromCheckpoint(stream);
            if (fromCheckpoint.isPresent()) {
                return fromCheckpoint.get();
            }
            Optional<StreamPosition> fromStateChange = positionFromLatestStateChange(sagaId);
            if (fromStateChange.isPresent()) {
                return refine(sagaId, fromStateChange.get());
            }
            return countSteps(stream, new StreamPosition(0, 0));
        } catch (EventStoreException e) {
            throw new SagaPersistenceException(sagaId, "failed to read event stream of saga " + sagaId, e);
        }
    }

    private Optional<StreamPosition> positionFromSnapshot(String sagaId) {
        Optional<Snapshot> snapshot = readSnapshot(sagaId);
        if (snapshot.isEmpty()) {
            return Optional.empty();
        }
        long version = snapshot.get().getLong(SagaEventTypes.LAST_SAVED_VERSION, -1);
        long count = snapshot.get().getLong(SagaEventTypes.SAVED_HISTORY_COUNT, -1);
        if (version < 0 || count < 0) {
            return Optional.empty();
        }
        return Optional.of(new StreamPosition(version, (int) count));
    }

    private Optional<StreamPosition> positionFromCheckpoint(List<StoredEvent> stream) {
        for (int i = stream.size() - 1; i >= 0; i--) {
            StoredEvent event = stream.get(i);
            if (!SagaEventTypes.SAGA_STATE_CHECKPOINT.equals(event.eventType())) {
                continue;
            }
            long count = event.getLong(SagaEventTypes.SAVED_HISTORY_COUNT, -1);
            if (count < 0) {
                return Optional.empty();
            }
            StreamPosition known = new StreamPosition(event.version(), (int) count);
            return Optional.of(countSteps(stream.subList(i + 1, stream.size()), known));
        }
        return Optional.empty();
    }

    // pre-checkpoint streams: the state change records the position before its batch
    private Optional<StreamPosition> positionFromLatestStateChange(String sagaId) {
        StoredEvent latest = null;
        for (StoredEvent event : eventStore.getEventsByType(SagaEventTypes.SAGA_STATE_CHANGED, Instant.EPOCH)) {
            if (sagaId.equals(event.aggregateId()) && (latest == null || event.version() > latest.version())) {
                latest = event;
            }
        }
        if (latest == null) {
            return Optional.empty();
        }
        long count = latest.getLong(SagaEventTypes.SAVED_HISTORY_COUNT, -1);
        if (count < 0) {
            return Optional.empty();
        }
        return Optional.of(new StreamPosition(latest.version(), (int) count));
    }

    private StreamPosition refine(String sagaId, StreamPosition known) {
        return countSteps(eventStore.getEvents(sagaId, known.version() + 1), known);
    }

    // checkpoints reset the count, step events add one each
    private static StreamPosition countSteps(List<StoredEvent> events, StreamPosition known) {
        long version = known.version();
        int count = known.savedHistoryCount();
        for (StoredEvent event : events) {
            version = event.version();
            if (SagaEventTypes.SAGA_STATE_CHECKPOINT.equals(event.eventType())) {
                count = (int) event.getLong(SagaEventTypes.SAVED_HISTORY_COUNT, count);
            } else if (SagaEventTypes.isStepEvent(event.eventType())) {
                count++;
            }
        }
        return new StreamPosition(version, count);
    }

    private void updateSnapshot(SagaInstance saga, int previousCount, int newCount, long newVersion) {
        String sagaId = saga.getId();
        if (newCount / snapshotFrequency > previousCount / snapshotFrequency) {
            byte[] state;
            try {
                state = objectMapper.writeValueAsBytes(SagaStateDocument.from(saga));
            } catch (JsonProcessingException e) {
                throw new SagaPersistenceException(sagaId, "failed to serialize snapshot of saga " + sagaId, e);
            }
            Snapshot snapshot = new Snapshot(sagaId, AGGREGATE_TYPE, newVersion, state,
                    snapshotMetadata(saga, newVersion, newVersion, newCount), Instant.now());
            try {
                snapshotStore.saveSnapshot(snapshot);
            } catch (RuntimeException e) {
                throw new SagaPersistenceException(sagaId, "failed to save snapshot of saga " + sagaId, e);
            }
            log.debug("Saga {} snapshot taken at version {}", sagaId, newVersion);
            return;
        }

        try {
            Optional<Snapshot> existing = snapshotStore.getSnapshot(sagaId);
            Snapshot refreshed;
            if (existing.isPresent()) {
                Snapshot current = existing.get();
                long stateVersion = current.getLong(STATE_VERSION, current.version());
                refreshed = new Snapshot(sagaId, AGGREGATE_TYPE, current.version(), current.state(),
                        snapshotMetadata(saga, stateVersion, newVersion, newCount), current.createdAt());
            } else {
                refreshed = new Snapshot(sagaId, AGGREGATE_TYPE, 0, new byte[0],
                        snapshotMetadata(saga, 0, newVersion, newCount), Instant.now());
            }
            snapshotStore.saveSnapshot(refreshed);
        } catch (RuntimeException e) {
            log.warn("Failed to refresh snapshot metadata of saga {}: {}", sagaId, e.getMessage());
        }
    }

    private static Map<String, Object> snapshotMetadata(SagaInstance saga, long stateVersion, long savedVersion,
            int savedHistoryCount) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put(SagaEventTypes.DEFINITION_NAME, saga.getDefinition().getName());
        metadata.put(STATE_VERSION, stateVersion);
        metadata.put(SagaEventTypes.LAST_SAVED_VERSION, savedVersion);
        metadata.put(SagaEventTypes.SAVED_HISTORY_COUNT, savedHistoryCount);
        return metadata;
    }

    private Optional<Snapshot> readSnapshot(String sagaId) {
        if (snapshotStore == null) {
            return Optional.empty();
        }
        try {
            return snapshotStore.getSnapshot(sagaId);
        } catch (RuntimeException e) {
            log.warn("Failed to read snapshot of saga {}, falling back to the event stream: {}", sagaId,
                    e.getMessage());
            return Optional.empty();
        }
    }

    @Override
    public SagaInstance load(String sagaId) {
        return replay(sagaId).toInstance(registry);
    }

    private ReplayedSaga replay(String sagaId) {
        try {
            Optional<Snapshot> snapshot = readSnapshot(sagaId);
            if (snapshot.isPresent() && snapshot.get().hasState()) {
                SagaStateDocument document = objectMapper.readValue(snapshot.get().state(), SagaStateDocument.class);
                long stateVersion = snapshot.get().getLong(STATE_VERSION, snapshot.get().version());
                ReplayedSaga replayed = ReplayedSaga.fromDocument(document);
                replayed.applyAll(eventStore.getEvents(sagaId, stateVersion + 1));
                return replayed;
            }
            List<StoredEvent> events = eventStore.getEvents(sagaId, 1);
            if (events.isEmpty()) {
                throw new SagaPersistenceException(sagaId, "saga " + sagaId + " not found");
            }
            ReplayedSaga replayed = new ReplayedSaga(sagaId);
            replayed.applyAll(events);
            return replayed;
        } catch (EventStoreException | IOException e) {
            throw new SagaPersistenceException(sagaId, "failed to load saga " + sagaId, e);
        }
    }

    /**
     * Loads every saga whose latest recorded status is {@code status}. Sagas whose
     * definition is no longer registered are skipped.
     */
    @Override
    public List<SagaInstance> loadAll(SagaStatus status) {
        Map<String, StoredEvent> latest = new LinkedHashMap<>();
        try {
            for (StoredEvent event : eventStore.getEventsByType(SagaEventTypes.SAGA_STATE_CHANGED, Instant.EPOCH)) {
                latest.merge(event.aggregateId(), event,
                        (current, candidate) -> candidate.version() > current.version() ? candidate : current);
            }
        } catch (EventStoreException e) {
            throw new SagaPersistenceException(null, "failed to query saga state events", e);
        }

        List<SagaInstance> result = new ArrayList<>();
        for (StoredEvent event : latest.values()) {
            if (!status.value().equals(event.getString(SagaEventTypes.STATUS))) {
                continue;
            }
            try {
                SagaInstance saga = load(event.aggregateId());
                if (saga.getStatus() == status) {
                    result.add(saga);
                }
            } catch (SagaException e) {
                log.warn("Skipping saga {} while listing {} sagas: {}", event.aggregateId(), status.value(),
                        e.getMessage());
            }
        }
        return result;
    }

    /**
     * Event streams are append-only.
     *
     * @throws UnsupportedOperationException always
     */
    @Override
    public void delete(String sagaId) {
        throw new UnsupportedOperationException("event-sourced saga streams cannot be deleted");
    }

    @Override
    public List<SagaHistory> getHistory(String sagaId) {
        return replay(sagaId).history();
    }

    record StreamPosition(long version, int savedHistoryCount) {
    }

    /**
     * Saga state being rebuilt from a snapshot and/or events. History entries are keyed by
     * step name and start time so that re-runs of a step stay distinct.
     */
    private static final class ReplayedSaga {

        private final String id;
        private final Map<String, SagaHistory> history = new LinkedHashMap<>();
        private String definitionName;
        private SagaStatus status = SagaStatus.PENDING;
        private String currentStep;
        private Map<String, Object> context = Map.of();
        private Instant startedAt;
        private Instant completedAt;
        private Instant createdAt;
        private Instant updatedAt;

        ReplayedSaga(String id) {
            this.id = id;
        }

        static ReplayedSaga fromDocument(SagaStateDocument document) {
            ReplayedSaga replayed = new ReplayedSaga(document.id());
            replayed.definitionName = document.definitionName();
            replayed.status = SagaStatus.fromValue(document.status());
            replayed.currentStep = document.currentStep();
            replayed.context = document.context() == null ? Map.of() : document.context();
            replayed.startedAt = document.startedAt();
            replayed.completedAt = document.completedAt();
            replayed.createdAt = document.createdAt();
            replayed.updatedAt = document.updatedAt();
            for (SagaHistory entry : document.toHistory()) {
                replayed.history.put(key(entry), entry);
            }
            return replayed;
        }

        void applyAll(List<StoredEvent> events) {
            for (StoredEvent event : events) {
                apply(event);
            }
        }

        @SuppressWarnings("unchecked")
        private void apply(StoredEvent event) {
            if (createdAt == null) {
                createdAt = event.occurredAt();
            }
            if (SagaEventTypes.SAGA_STATE_CHANGED.equals(event.eventType())) {
                status = SagaStatus.fromValue(event.getString(SagaEventTypes.STATUS));
                String step = event.getString(SagaEventTypes.STEP);
                currentStep = step == null || step.isEmpty() ? null : step;
                Object contextValue = event.get(SagaEventTypes.CONTEXT);
                context = contextValue instanceof Map ? (Map<String, Object>) contextValue : Map.of();
                definitionName = event.getString(SagaEventTypes.DEFINITION_NAME);
                startedAt = parseInstant(event.getString(SagaEventTypes.STARTED_AT));
                completedAt = parseInstant(event.getString(SagaEventTypes.COMPLETED_AT));
                updatedAt = event.occurredAt();
            } else if (SagaEventTypes.isStepEvent(event.eventType())) {
                SagaHistory entry = StepEvents.fromMetadata(event.eventType(), event.metadata());
                history.put(key(entry), entry);
            }
        }

        List<SagaHistory> history() {
            return List.copyOf(history.values());
        }

        SagaInstance toInstance(SagaRegistry registry) {
            if (definitionName == null) {
                throw new SagaPersistenceException(id, "saga " + id + " has no recorded definition");
            }
            SagaDefinition definition = registry.get(definitionName);
            SagaContext restored = SagaContext.restore(context, createdAt, updatedAt);
            return SagaInstance.restore(id, definition, restored, status, currentStep, history(), startedAt,
                    completedAt);
        }

        private static String key(SagaHistory entry) {
            return entry.stepName() + "|" + entry.startedAt();
        }

        private static Instant parseInstant(String value) {
            return value == null || value.isEmpty() ? null : Instant.parse(value);
        }
    }
}
