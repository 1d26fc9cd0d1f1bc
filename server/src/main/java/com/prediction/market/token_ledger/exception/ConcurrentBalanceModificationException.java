package com.prediction.market.token_ledger.exception;

/**
 * A version-guarded write found the stored record changed since it was read.
 * Callers retry the whole read-compute-write cycle.
 */
public class ConcurrentBalanceModificationException extends RuntimeException {

    private final String userId;
    private final long expectedVersion;

    public ConcurrentBalanceModificationException(String userId, long expectedVersion) {
        super(String.format("Balance for user %s was modified concurrently (expected version %d)",
                userId, expectedVersion));
        this.userId = userId;
        this.expectedVersion = expectedVersion;
    }

    public ConcurrentBalanceModificationException(String message, Throwable cause) {
        super(message, cause);
        this.userId = null;
        this.expectedVersion = -1;
    }

    public String getUserId() {
        return userId;
    }

    public long getExpectedVersion() {
        return expectedVersion;
    }
}
