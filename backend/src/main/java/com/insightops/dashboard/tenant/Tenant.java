package com.insightops.dashboard.tenant;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One customer organization: the isolation boundary of every core component.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class Tenant {

    /** Opaque tenant id used to partition all state */
    private String id;

    /** Display name */
    private String name;

    /** Deactivated tenants keep their settings but are never polled */
    @Builder.Default
    private boolean active = true;

    private DevOpsCredentials credentials;

    @Builder.Default
    private PollingSettings polling = new PollingSettings();

    public boolean hasCompleteCredentials() {
        return credentials != null && credentials.isComplete();
    }
}
