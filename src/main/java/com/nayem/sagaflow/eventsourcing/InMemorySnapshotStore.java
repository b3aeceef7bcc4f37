package com.nayem.sagaflow.eventsourcing;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory implementation of {@link SnapshotStore}. State is lost on restart.
 */
public class InMemorySnapshotStore implements SnapshotStore {

    private final Map<String, Snapshot> snapshots = new ConcurrentHashMap<>();

    @Override
    public void saveSnapshot(Snapshot snapshot) {
        snapshots.put(snapshot.aggregateId(), snapshot);
    }

    @Override
    public Optional<Snapshot> getSnapshot(String aggregateId) {
        return Optional.ofNullable(snapshots.get(aggregateId));
    }

    @Override
    public void deleteSnapshots(String aggregateId, long beforeVersion) {
        snapshots.computeIfPresent(aggregateId,
                (id, snapshot) -> snapshot.version() < beforeVersion ? null : snapshot);
    }

    public int size() {
        return snapshots.size();
    }
}
