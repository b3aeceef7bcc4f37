package com.nayem.sagaflow.persistence;

import com.nayem.sagaflow.saga.SagaHistory;
import com.nayem.sagaflow.saga.SagaInstance;
import com.nayem.sagaflow.saga.SagaPersistence;
import com.nayem.sagaflow.saga.SagaPersistenceException;
import com.nayem.sagaflow.saga.SagaStatus;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory implementation of {@link SagaPersistence}.
 * <p>
 * Keeps the live instances themselves, so a load returns the same object that was saved.
 * Suitable for development, testing and single-instance deployments; state is lost on restart.
 * </p>
 */
public class InMemorySagaPersistence implements SagaPersistence {

    private final Map<String, SagaInstance> store = new ConcurrentHashMap<>();

    @Override
    public void save(SagaInstance saga) {
        store.put(saga.getId(), saga);
    }

    @Override
    public SagaInstance load(String sagaId) {
        SagaInstance saga = store.get(sagaId);
        if (saga == null) {
            throw new SagaPersistenceException(sagaId, "saga " + sagaId + " not found");
        }
        return saga;
    }

    @Override
    public List<SagaInstance> loadAll(SagaStatus status) {
        return store.values().stream()
                .filter(saga -> saga.getStatus() == status)
                .toList();
    }

    @Override
    public void delete(String sagaId) {
        store.remove(sagaId);
    }

    @Override
    public List<SagaHistory> getHistory(String sagaId) {
        return load(sagaId).getHistory();
    }

    /**
     * Clears all stored state. Useful for testing.
     */
    public void clear() {
        store.clear();
    }

    public int size() {
        return store.size();
    }
}
