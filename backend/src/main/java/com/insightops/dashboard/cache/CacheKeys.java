package com.insightops.dashboard.cache;

/**
 * Key names shared by the polling tasks that write the cache and the webhook
 * handlers that evict from it.
 */
public final class CacheKeys {

    public static final String WORK_ITEMS = "workItems";
    public static final String OVERDUE_WORK_ITEMS = "overdueWorkItems";
    public static final String PULL_REQUESTS = "pullRequests";
    public static final String BUILDS = "builds";
    public static final String RELEASES = "releases";

    private CacheKeys() {
    }

    /**
     * Namespaces a resource key by project, e.g. {@code pullRequests:Payments}.
     * The resource stays first so that {@link TenantCache#evictByPrefix} can drop
     * a resource for every project at once.
     */
    public static String forProject(String resource, String project) {
        if (project == null || project.isBlank()) {
            return resource;
        }
        return resource + ":" + project;
    }
}
