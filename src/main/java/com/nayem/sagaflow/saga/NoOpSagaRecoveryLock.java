package com.nayem.sagaflow.saga;

import java.time.Duration;

/**
 * Lock for single-node deployments: always granted.
 */
public class NoOpSagaRecoveryLock implements SagaRecoveryLock {
    @Override
    public boolean acquireLock(String lockKey, Duration duration) {
        return true;
    }

    @Override
    public void releaseLock(String lockKey) {
    }
}
