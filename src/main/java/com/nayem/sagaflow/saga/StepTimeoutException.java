package com.nayem.sagaflow.saga;

import java.time.Duration;

/**
 * A single step attempt exceeded its deadline.
 */
public class StepTimeoutException extends SagaException {

    public StepTimeoutException(String sagaId, String stepName, Duration timeout) {
        super(sagaId, "step " + stepName + " timed out after " + timeout.toMillis() + "ms");
    }
}
