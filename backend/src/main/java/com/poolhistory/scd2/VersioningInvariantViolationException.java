package com.poolhistory.scd2;

/**
 * The dimension history is inconsistent (overlapping intervals, zero or several current rows,
 * out-of-order snapshot). A run that hits this must abort without persisting anything.
 */
public class VersioningInvariantViolationException extends RuntimeException {

    private final String poolId;

    public VersioningInvariantViolationException(String poolId, String message) {
        super("pool " + poolId + ": " + message);
        this.poolId = poolId;
    }

    public String getPoolId() {
        return poolId;
    }
}
