package com.insightops.dashboard.status;

import com.insightops.dashboard.cache.CacheStats;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.Map;

/**
 * Point-in-time view of the scheduling subsystem, served by {@code GET /api/status}
 * and pushed over {@code /ws/status}.
 */
@Value
@Builder
public class StatusSnapshot {

    Instant timestamp;
    Map<String, TenantSummary> tenants;
    int totalActiveTimers;
    CacheStats cache;
    int lockTableSize;
    int dedupeTableSize;
}
