package com.insightops.dashboard.cache;

import lombok.Value;

/**
 * Point-in-time counters of the {@link TenantCache}, read by the status surface.
 */
@Value
public class CacheStats {

    long hits;

    long misses;

    long sets;

    /** Hit percentage with one decimal, e.g. {@code "87.5%"}. */
    String hitRate;

    int tenants;

    int totalEntries;
}
