package com.insightops.dashboard.devops;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * Represents a single Azure DevOps REST endpoint loaded from devops-endpoints.yaml.
 * The base URL is not part of the definition: it comes from each tenant's credentials.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EndpointDefinition {

    /** Unique identifier for this endpoint (e.g. "list_active_pull_requests") */
    private String name;

    /** The URL path template, including api-version (e.g. "/{organization}/{project}/_apis/wit/wiql?api-version=7.0") */
    private String path;

    /** HTTP method: GET or POST */
    private String method;

    /** Human-readable description of the endpoint */
    private String description;

    /**
     * Builds the full URL by combining the tenant's base URL with the path, replacing path parameters.
     *
     * @param baseUrl    service root without trailing slash (e.g. "https://dev.azure.com")
     * @param pathParams key-value pairs for path parameter substitution (e.g. "project" -> "Payments")
     * @return the fully-resolved URL ready for HTTP invocation
     */
    public String buildUrl(String baseUrl, Map<String, String> pathParams) {
        String fullUrl = baseUrl + path;
        if (pathParams != null) {
            for (Map.Entry<String, String> entry : pathParams.entrySet()) {
                fullUrl = fullUrl.replace("{" + entry.getKey() + "}", entry.getValue());
            }
        }
        return fullUrl;
    }
}
