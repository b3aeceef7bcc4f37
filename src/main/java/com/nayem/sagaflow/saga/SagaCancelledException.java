package com.nayem.sagaflow.saga;

/**
 * The saga was cancelled (or timed out) while a step or a retry back-off was in flight.
 */
public class SagaCancelledException extends SagaException {

    public SagaCancelledException(String sagaId, String stepName, Throwable cause) {
        super(sagaId, "saga " + sagaId + " cancelled during step " + stepName, cause);
    }
}
