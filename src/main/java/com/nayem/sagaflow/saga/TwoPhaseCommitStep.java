package com.nayem.sagaflow.saga;

import java.time.Duration;
import java.util.List;
import java.util.function.Function;

/**
 * Step that runs a two-phase commit across the participants resolved from the context.
 * <p>
 * The transaction id is kept under {@code transaction_id} so compensation can abort
 * the same transaction; compensation stops at the first participant that fails to abort.
 * </p>
 */
public class TwoPhaseCommitStep implements SagaStep {

    public static final String TRANSACTION_ID_KEY = "transaction_id";

    private final String name;
    private final TwoPhaseCommitCoordinator coordinator;
    private final Function<SagaContext, List<TwoPhaseCommitParticipant>> participants;
    private final StepOptions options;

    public TwoPhaseCommitStep(String name, TwoPhaseCommitCoordinator coordinator,
            Function<SagaContext, List<TwoPhaseCommitParticipant>> participants) {
        this(name, coordinator, participants, StepOptions.defaults());
    }

    public TwoPhaseCommitStep(String name, TwoPhaseCommitCoordinator coordinator,
            Function<SagaContext, List<TwoPhaseCommitParticipant>> participants, StepOptions options) {
        if (name == null || name.isBlank()) {
            throw new IllegalStateException("step name is required");
        }
        if (coordinator == null || participants == null) {
            throw new IllegalStateException("coordinator and participants are required for step " + name);
        }
        this.name = name;
        this.coordinator = coordinator;
        this.participants = participants;
        this.options = options == null ? StepOptions.defaults() : options;
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public void execute(SagaContext context) throws Exception {
        String transactionId = context.getString(TRANSACTION_ID_KEY, "");
        if (transactionId.isEmpty()) {
            transactionId = "txn-" + System.nanoTime();
            context.set(TRANSACTION_ID_KEY, transactionId);
        }
        List<TwoPhaseCommitParticipant> resolved = participants.apply(context);
        if (resolved == null || resolved.isEmpty()) {
            throw new IllegalStateException("no participants for 2PC transaction " + transactionId);
        }
        coordinator.execute(transactionId, resolved);
    }

    @Override
    public void compensate(SagaContext context) throws Exception {
        String transactionId = context.getString(TRANSACTION_ID_KEY, "");
        if (transactionId.isEmpty()) {
            return;
        }
        List<TwoPhaseCommitParticipant> resolved = participants.apply(context);
        if (resolved == null) {
            return;
        }
        for (TwoPhaseCommitParticipant participant : resolved) {
            participant.abort(transactionId);
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
}
