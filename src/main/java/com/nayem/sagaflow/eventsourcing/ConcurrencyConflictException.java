package com.nayem.sagaflow.eventsourcing;

/**
 * The stream was written by someone else since the caller read its version.
 */
public class ConcurrencyConflictException extends EventStoreException {

    private final String aggregateId;
    private final long expectedVersion;
    private final long actualVersion;

    public ConcurrencyConflictException(String aggregateId, long expectedVersion, long actualVersion) {
        super("concurrency conflict on stream " + aggregateId + ": expected version " + expectedVersion
                + ", actual " + actualVersion);
        this.aggregateId = aggregateId;
        this.expectedVersion = expectedVersion;
        this.actualVersion = actualVersion;
    }

    public String getAggregateId() {
        return aggregateId;
    }

    public long getExpectedVersion() {
        return expectedVersion;
    }

    public long getActualVersion() {
        return actualVersion;
    }
}
