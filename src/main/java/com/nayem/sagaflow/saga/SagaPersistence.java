package com.nayem.sagaflow.saga;

import java.util.List;

/**
 * Durable storage for saga instances.
 * <p>
 * Callers must keep a single writer per saga; implementations do not serialize
 * concurrent saves of the same instance.
 * </p>
 */
public interface SagaPersistence {

    /**
     * @throws SagaPersistenceException when the state cannot be written
     */
    void save(SagaInstance saga);

    /**
     * @throws SagaPersistenceException          when nothing is stored under {@code sagaId}
     * @throws SagaDefinitionNotFoundException when the stored definition is not registered
     */
    SagaInstance load(String sagaId);

    List<SagaInstance> loadAll(SagaStatus status);

    void delete(String sagaId);

    List<SagaHistory> getHistory(String sagaId);
}
