package com.nayem.sagaflow.saga;

/**
 * A step failed after its retries were exhausted (or its guard rejected it).
 */
public class SagaStepException extends SagaException {

    private final String stepName;

    public SagaStepException(String sagaId, String stepName, Throwable cause) {
        super(sagaId, "step " + stepName + " failed: " + describe(cause), cause);
        this.stepName = stepName;
    }

    public SagaStepException(String sagaId, String stepName, String message, Throwable cause) {
        super(sagaId, message, cause);
        this.stepName = stepName;
    }

    public String getStepName() {
        return stepName;
    }

    static String describe(Throwable error) {
        if (error == null) {
            return "unknown error";
        }
        String message = error.getMessage();
        return message == null || message.isBlank() ? error.getClass().getSimpleName() : message;
    }
}
