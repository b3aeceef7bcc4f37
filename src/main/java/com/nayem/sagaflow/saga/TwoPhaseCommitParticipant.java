package com.nayem.sagaflow.saga;

/**
 * Resource taking part in a two-phase commit.
 */
public interface TwoPhaseCommitParticipant {

    String getId();

    void prepare(String transactionId) throws Exception;

    void commit(String transactionId) throws Exception;

    void abort(String transactionId) throws Exception;
}
