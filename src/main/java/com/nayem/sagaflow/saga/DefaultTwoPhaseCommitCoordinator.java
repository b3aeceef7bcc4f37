package com.nayem.sagaflow.saga;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Prepares every participant, then commits them. A failed prepare aborts all participants.
 * <p>
 * A commit failure after a successful prepare phase is reported but the remaining
 * participants are still committed; the decision has been taken at that point.
 * </p>
 */
public class DefaultTwoPhaseCommitCoordinator implements TwoPhaseCommitCoordinator {

    private static final Logger log = LoggerFactory.getLogger(DefaultTwoPhaseCommitCoordinator.class);

    @Override
    public void execute(String transactionId, List<TwoPhaseCommitParticipant> participants) throws Exception {
        for (TwoPhaseCommitParticipant participant : participants) {
            try {
                participant.prepare(transactionId);
            } catch (Exception e) {
                log.warn("Transaction {} prepare failed on {}, aborting", transactionId, participant.getId());
                abortAll(transactionId, participants, e);
                throw e;
            }
        }

        List<Exception> commitErrors = new ArrayList<>();
        for (TwoPhaseCommitParticipant participant : participants) {
            try {
                participant.commit(transactionId);
            } catch (Exception e) {
                log.error("Transaction {} commit failed on {}", transactionId, participant.getId(), e);
                commitErrors.add(e);
            }
        }
        if (!commitErrors.isEmpty()) {
            Exception first = commitErrors.get(0);
            for (int i = 1; i < commitErrors.size(); i++) {
                first.addSuppressed(commitErrors.get(i));
            }
            throw first;
        }
    }

    private void abortAll(String transactionId, List<TwoPhaseCommitParticipant> participants, Exception cause) {
        for (TwoPhaseCommitParticipant participant : participants) {
            try {
                participant.abort(transactionId);
            } catch (Exception e) {
                log.warn("Transaction {} abort failed on {}: {}", transactionId, participant.getId(), e.getMessage());
                cause.addSuppressed(e);
            }
        }
    }
}
