package com.nayem.sagaflow.saga;

/**
 * Saga state could not be saved or loaded. Execution stops where it happened.
 */
public class SagaPersistenceException extends SagaException {

    public SagaPersistenceException(String sagaId, String message) {
        super(sagaId, message);
    }

    public SagaPersistenceException(String sagaId, String message, Throwable cause) {
        super(sagaId, message, cause);
    }
}
