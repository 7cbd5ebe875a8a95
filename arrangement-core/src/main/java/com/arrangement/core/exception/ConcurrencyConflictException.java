package com.arrangement.core.exception;

/**
 * Thrown when an append is attempted with a stale expected version.
 * Never retried by the store; reconciling against newer events is the caller's decision.
 */
public class ConcurrencyConflictException extends ArrangementException {

    public static final String ERROR_CODE = "CONCURRENCY_CONFLICT";

    private final String aggregateId;
    private final long expectedVersion;
    private final long actualVersion;

    public ConcurrencyConflictException(String aggregateId, long expectedVersion, long actualVersion) {
        super(ERROR_CODE, String.format(
            "Concurrency conflict on %s: expected version %d, but current version is %d",
            aggregateId, expectedVersion, actualVersion
        ));
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

    @Override
    public boolean isRetryable() {
        return true;
    }
}
