package com.nayem.sagaflow.saga;

import java.util.List;

/**
 * Drives prepare/commit/abort across participants.
 */
public interface TwoPhaseCommitCoordinator {

    void execute(String transactionId, List<TwoPhaseCommitParticipant> participants) throws Exception;
}
