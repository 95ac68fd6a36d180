package com.insightops.dashboard.tenant;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.ToString;

/**
 * Connection settings a tenant uses to reach its Azure DevOps organization.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class DevOpsCredentials {

    public static final String DEFAULT_BASE_URL = "https://dev.azure.com";

    /** Azure DevOps organization name (e.g. "contoso") */
    private String organization;

    /** Default project polled for this tenant */
    private String project;

    /** Personal access token used for Basic authentication */
    @ToString.Exclude
    private String pat;

    /** Service root, {@value #DEFAULT_BASE_URL} unless the tenant runs on-premises */
    private String baseUrl;

    /**
     * Whether organization, project and token are all present. Polling is skipped
     * for tenants whose credentials are incomplete.
     */
    public boolean isComplete() {
        return isPresent(organization) && isPresent(project) && isPresent(pat);
    }

    public String resolvedBaseUrl() {
        String url = isPresent(baseUrl) ? baseUrl : DEFAULT_BASE_URL;
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }

    private static boolean isPresent(String value) {
        return value != null && !value.isBlank();
    }
}
