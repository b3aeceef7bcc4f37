package com.nayem.sagaflow.saga;

import java.time.Duration;

/**
 * Elects the single node that runs a recovery scan. {@link SagaRecoveryService} takes
 * the {@code recovery-leader} key before each cycle and skips the cycle when another
 * node holds it.
 */
public interface SagaRecoveryLock {

    /**
     * @param duration Lease length; the lock frees itself after it even if never released
     * @return whether this node now holds {@code lockKey}
     */
    boolean acquireLock(String lockKey, Duration duration);

    /**
     * Releases {@code lockKey} if this node holds it; otherwise does nothing.
     */
    void releaseLock(String lockKey);
}
