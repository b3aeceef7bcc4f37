package com.nayem.sagaflow.saga;

/**
 * Forward or compensating action of a step.
 */
@FunctionalInterface
public interface StepAction {

    void run(SagaContext context) throws Exception;
}
