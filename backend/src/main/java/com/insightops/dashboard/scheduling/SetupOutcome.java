package com.insightops.dashboard.scheduling;

/**
 * Result of a tenant setup operation. Configuration problems and contention are
 * reported through these values rather than thrown to the caller.
 */
public enum SetupOutcome {
    STARTED,
    UPDATED,
    STOPPED,
    /** Another start/update/stop for the same tenant was still running */
    ALREADY_IN_PROGRESS,
    TENANT_NOT_FOUND,
    TENANT_INACTIVE,
    MISSING_CREDENTIALS,
    /** The tenant lookup or the job store threw during setup */
    FAILED;

    public boolean isApplied() {
        return this == STARTED || this == UPDATED || this == STOPPED;
    }
}
