package com.nayem.sagaflow.saga;

/**
 * A step's guard returned {@code false}.
 */
public class StepGuardException extends SagaException {

    public StepGuardException(String sagaId, String stepName) {
        super(sagaId, "step " + stepName + " guard check failed");
    }
}
