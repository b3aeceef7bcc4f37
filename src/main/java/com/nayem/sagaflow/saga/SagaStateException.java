package com.nayem.sagaflow.saga;

/**
 * An operation was requested in a status that does not allow it.
 */
public class SagaStateException extends SagaException {

    private final SagaStatus status;

    public SagaStateException(String sagaId, SagaStatus status, String message) {
        super(sagaId, message);
        this.status = status;
    }

    public SagaStatus getStatus() {
        return status;
    }
}
