package com.nayem.sagaflow.saga;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Fans out to child steps that run concurrently, one worker per child.
 * <p>
 * Every child runs to completion even when a sibling fails; the step reports only
 * after all children have reported, and the error lists every failing child. The
 * names of the children that succeeded are kept in the context under
 * {@code <name>.completed_children} so compensation only touches them.
 * </p>
 */
public class ParallelSagaStep implements SagaStep {

    private static final Logger log = LoggerFactory.getLogger(ParallelSagaStep.class);

    private final String name;
    private final List<SagaStep> children;
    private final StepOptions options;
    private final Executor executor;
    private final boolean compensateOnFailure;

    private ParallelSagaStep(Builder builder) {
        this.name = builder.name;
        this.children = List.copyOf(builder.children);
        this.options = builder.options;
        this.executor = builder.executor;
        this.compensateOnFailure = builder.compensateOnFailure;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static ParallelSagaStep of(String name, SagaStep... children) {
        Builder builder = builder().name(name);
        for (SagaStep child : children) {
            builder.step(child);
        }
        return builder.build();
    }

    @Override
    public String getName() {
        return name;
    }

    public List<SagaStep> getChildren() {
        return children;
    }

    public String completedChildrenKey() {
        return name + ".completed_children";
    }

    @Override
    public void execute(SagaContext context) throws Exception {
        BlockingQueue<ChildResult> results = new ArrayBlockingQueue<>(children.size());
        List<ChildTask> tasks = new ArrayList<>(children.size());
        for (SagaStep child : children) {
            ChildTask task = new ChildTask(child, context, results);
            tasks.add(task);
            try {
                executor.execute(task);
            } catch (RejectedExecutionException e) {
                task.report(e);
            }
        }

        List<ChildResult> collected = new ArrayList<>(children.size());
        InterruptedException interrupted = null;
        while (collected.size() < children.size()) {
            try {
                collected.add(results.take());
            } catch (InterruptedException e) {
                if (interrupted == null) {
                    interrupted = e;
                    tasks.forEach(ChildTask::cancel);
                }
            }
        }

        Map<String, Throwable> failures = new LinkedHashMap<>();
        List<String> succeeded = new ArrayList<>();
        for (SagaStep child : children) {
            for (ChildResult result : collected) {
                if (result.step() == child) {
                    if (result.error() == null) {
                        succeeded.add(child.getName());
                    } else {
                        failures.put(child.getName(), result.error());
                    }
                }
            }
        }
        context.set(completedChildrenKey(), succeeded);

        if (interrupted != null) {
            throw interrupted;
        }
        if (!failures.isEmpty()) {
            ParallelStepException error = new ParallelStepException("execution", failures);
            if (compensateOnFailure && !succeeded.isEmpty()) {
                log.warn("Parallel step {} failed for {}, compensating {}", name, error.getFailedSteps(), succeeded);
                try {
                    compensate(context);
                } catch (Exception compensationError) {
                    error.addSuppressed(compensationError);
                }
            }
            throw error;
        }
    }

    /**
     * Compensates, in reverse declaration order, every child whose execution did not error.
     * Without a recorded outcome every child is compensated.
     */
    @Override
    public void compensate(SagaContext context) throws Exception {
        Set<String> completed = context.containsKey(completedChildrenKey())
                ? new HashSet<>(context.getStringList(completedChildrenKey()))
                : null;

        Map<String, Throwable> failures = new LinkedHashMap<>();
        List<String> remaining = new ArrayList<>();
        for (int i = children.size() - 1; i >= 0; i--) {
            SagaStep child = children.get(i);
            if (completed != null && !completed.contains(child.getName())) {
                continue;
            }
            try {
                child.compensate(context);
            } catch (Exception e) {
                failures.put(child.getName(), e);
                remaining.add(0, child.getName());
            }
        }
        context.set(completedChildrenKey(), remaining);
        if (!failures.isEmpty()) {
            throw new ParallelStepException("compensation", failures);
        }
    }

    @Override
    public boolean canExecute(SagaContext context) {
        return options.allows(context);
    }

    @Override
    public Duration getTimeout() {
        return options.timeout();
    }

    @Override
    public RetryPolicy getRetryPolicy() {
        return options.retryPolicy();
    }

    private record ChildResult(SagaStep step, Throwable error) {
    }

    private static final class ChildTask implements Runnable {
        private final SagaStep step;
        private final SagaContext context;
        private final BlockingQueue<ChildResult> results;
        private Thread worker;
        private boolean cancelled;
        private boolean reported;

        ChildTask(SagaStep step, SagaContext context, BlockingQueue<ChildResult> results) {
            this.step = step;
            this.context = context;
            this.results = results;
        }

        @Override
        public void run() {
            synchronized (this) {
                if (cancelled) {
                    report(new InterruptedException("parallel step cancelled before " + step.getName() + " started"));
                    return;
                }
                worker = Thread.currentThread();
            }
            Throwable error = null;
            try {
                if (!step.canExecute(context)) {
                    error = new IllegalStateException("step " + step.getName() + " guard check failed");
                } else {
                    step.execute(context);
                }
            } catch (Throwable t) {
                error = t;
            } finally {
                synchronized (this) {
                    worker = null;
                }
                Thread.interrupted();
            }
            report(error);
        }

        synchronized void cancel() {
            cancelled = true;
            if (worker != null) {
                worker.interrupt();
            }
        }

        synchronized void report(Throwable error) {
            if (!reported) {
                reported = true;
                results.add(new ChildResult(step, error));
            }
        }
    }

    /**
     * Builder for {@link ParallelSagaStep}.
     */
    public static class Builder {
        private String name;
        private final List<SagaStep> children = new ArrayList<>();
        private StepOptions options = StepOptions.defaults();
        private Executor executor = SagaThreads.stepPool();
        private boolean compensateOnFailure = true;

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder step(SagaStep child) {
            this.children.add(child);
            return this;
        }

        public Builder steps(List<? extends SagaStep> steps) {
            this.children.addAll(steps);
            return this;
        }

        public Builder options(StepOptions options) {
            this.options = options == null ? StepOptions.defaults() : options;
            return this;
        }

        public Builder timeout(Duration timeout) {
            this.options = options.withTimeout(timeout);
            return this;
        }

        public Builder retryPolicy(RetryPolicy retryPolicy) {
            this.options = options.withRetryPolicy(retryPolicy);
            return this;
        }

        public Builder guard(StepGuard guard) {
            this.options = options.withGuard(guard);
            return this;
        }

        /**
         * Workers for the children. Must start every task without queueing behind the others.
         */
        public Builder executor(Executor executor) {
            this.executor = executor;
            return this;
        }

        /**
         * Whether the succeeded children are compensated right away when a sibling fails.
         * The saga only compensates steps that completed, so a failed parallel step is
         * otherwise left half-applied. Default: true
         */
        public Builder compensateOnFailure(boolean compensateOnFailure) {
            this.compensateOnFailure = compensateOnFailure;
            return this;
        }

        public ParallelSagaStep build() {
            if (name == null || name.isBlank()) {
                throw new IllegalStateException("step name is required");
            }
            if (children.isEmpty()) {
                throw new IllegalStateException("parallel step " + name + " needs at least one child step");
            }
            Set<String> names = new HashSet<>();
            for (SagaStep child : children) {
                if (!names.add(child.getName())) {
                    throw new IllegalStateException("duplicate child step name: " + child.getName());
                }
            }
            if (executor == null) {
                throw new IllegalStateException("executor is required");
            }
            return new ParallelSagaStep(this);
        }
    }
}
