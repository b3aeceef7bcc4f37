package com.nayem.sagaflow.eventsourcing;

import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class InMemorySnapshotStoreTest {

    @Test
    void testLatestSnapshotReplacesPrevious() {
        InMemorySnapshotStore store = new InMemorySnapshotStore();
        store.saveSnapshot(snapshot("saga-1", 4));
        store.saveSnapshot(snapshot("saga-1", 8));

        assertEquals(8, store.getSnapshot("saga-1").orElseThrow().version());
        assertEquals(1, store.size());
        assertTrue(store.getSnapshot("saga-2").isEmpty());
    }

    @Test
    void testDeleteOnlyOlderSnapshots() {
        InMemorySnapshotStore store = new InMemorySnapshotStore();
        store.saveSnapshot(snapshot("saga-1", 8));

        store.deleteSnapshots("saga-1", 8);
        assertTrue(store.getSnapshot("saga-1").isPresent());

        store.deleteSnapshots("saga-1", 9);
        assertTrue(store.getSnapshot("saga-1").isEmpty());
    }

    @Test
    void testSnapshotWithoutState() {
        Snapshot empty = new Snapshot("saga-1", "saga", 0, null, Map.of("saved_history_count", 3L), Instant.now());

        assertFalse(empty.hasState());
        assertEquals(3, empty.getLong("saved_history_count", 0));
        assertEquals(-1, empty.getLong("missing", -1));
    }

    private static Snapshot snapshot(String id, long version) {
        return new Snapshot(id, "saga", version, "{}".getBytes(StandardCharsets.UTF_8), Map.of(), Instant.now());
    }
}
