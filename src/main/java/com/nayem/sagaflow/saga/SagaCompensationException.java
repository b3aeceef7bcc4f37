package com.nayem.sagaflow.saga;

/**
 * Compensating a step failed. The saga ends in {@link SagaStatus#FAILED}.
 */
public class SagaCompensationException extends SagaStepException {

    public SagaCompensationException(String sagaId, String stepName, Throwable cause) {
        super(sagaId, stepName, "compensation failed for step " + stepName + ": " + describe(cause), cause);
    }
}
