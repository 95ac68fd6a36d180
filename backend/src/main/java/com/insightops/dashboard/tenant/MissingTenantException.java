package com.insightops.dashboard.tenant;

/**
 * Thrown when an operation on tenant-partitioned state is attempted without a tenant id.
 * Callers must never fall back to an unscoped structure when they see this.
 */
public class MissingTenantException extends IllegalArgumentException {

    public MissingTenantException(String operation) {
        super("Tenant id is required for " + operation);
    }

    /**
     * Returns the tenant id unchanged, or throws if it is null or blank.
     *
     * @param tenantId  the tenant id supplied by the caller
     * @param operation short name of the operation, used in the message
     * @return the validated tenant id
     */
    public static String require(String tenantId, String operation) {
        if (tenantId == null || tenantId.isBlank()) {
            throw new MissingTenantException(operation);
        }
        return tenantId;
    }
}
