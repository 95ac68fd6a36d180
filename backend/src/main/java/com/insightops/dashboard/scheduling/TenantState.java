package com.insightops.dashboard.scheduling;

/**
 * Lifecycle of a tenant inside the scheduling manager.
 */
public enum TenantState {
    UNINITIALIZED,
    STARTING,
    RUNNING,
    STOPPING,
    STOPPED
}
