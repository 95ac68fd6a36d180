package com.insightops.dashboard.tenant;

import java.util.List;
import java.util.Optional;

/**
 * Tenant settings collaborator: where the scheduling subsystem reads a tenant's
 * credentials and polling settings from, and where it persists settings updates.
 */
public interface TenantDirectory {

    /** The tenant including its (decrypted) Azure DevOps credentials. */
    Optional<Tenant> getTenantWithCredentials(String tenantId);

    /** Active tenants whose stored settings enable at least one job type. */
    List<Tenant> findTenantsWithPollingEnabled();

    /** Replaces the stored polling settings of the tenant. */
    void updatePollingSettings(String tenantId, PollingSettings settings);
}
