package com.nayem.sagaflow.saga;

public class SagaNotRunningException extends SagaException {

    public SagaNotRunningException(String sagaId) {
        super(sagaId, "saga " + sagaId + " is not running");
    }
}
