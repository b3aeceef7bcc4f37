package com.nayem.sagaflow.saga;

@FunctionalInterface
public interface StepGuard {

    boolean test(SagaContext context);
}
