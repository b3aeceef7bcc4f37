package com.nayem.sagaflow.saga;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Thread factories and the shared pool used for timed step attempts and parallel children.
 */
public final class SagaThreads {

    private static final ExecutorService STEP_POOL =
            Executors.newCachedThreadPool(daemonFactory("sagaflow-step-"));

    private SagaThreads() {
    }

    /**
     * Unbounded pool: every submitted task starts immediately so a fan-out never waits
     * behind its own siblings.
     */
    public static ExecutorService stepPool() {
        return STEP_POOL;
    }

    public static ThreadFactory daemonFactory(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
