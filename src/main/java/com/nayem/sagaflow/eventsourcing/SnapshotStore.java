package com.nayem.sagaflow.eventsourcing;

import java.util.Optional;

/**
 * Keeps the latest {@link Snapshot} per aggregate.
 */
public interface SnapshotStore {

    /**
     * Stores {@code snapshot}, replacing the previous one of the same aggregate.
     */
    void saveSnapshot(Snapshot snapshot);

    Optional<Snapshot> getSnapshot(String aggregateId);

    /**
     * Removes the stored snapshot when its version is below {@code beforeVersion}.
     */
    void deleteSnapshots(String aggregateId, long beforeVersion);
}
