package com.nayem.sagaflow.saga;

/**
 * Base type for every error raised by the saga engine.
 */
public class SagaException extends RuntimeException {

    private final String sagaId;

    public SagaException(String sagaId, String message) {
        super(message);
        this.sagaId = sagaId;
    }

    public SagaException(String sagaId, String message, Throwable cause) {
        super(message, cause);
        this.sagaId = sagaId;
    }

    /**
     * @return id of the saga the error belongs to, {@code null} when not tied to one
     */
    public String getSagaId() {
        return sagaId;
    }
}
