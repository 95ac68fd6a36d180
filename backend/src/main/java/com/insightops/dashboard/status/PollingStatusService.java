package com.insightops.dashboard.status;

import com.insightops.dashboard.cache.TenantCache;
import com.insightops.dashboard.lock.ExecutionLock;
import com.insightops.dashboard.scheduling.SchedulingManager;
import com.insightops.dashboard.webhook.DuplicateEventFilter;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Assembles the read-only {@link StatusSnapshot} from the scheduling manager,
 * the tenant cache, the execution lock and the duplicate-event filter.
 */
@Service
@RequiredArgsConstructor
public class PollingStatusService {

    private final SchedulingManager schedulingManager;
    private final TenantCache tenantCache;
    private final ExecutionLock executionLock;
    private final DuplicateEventFilter duplicateEventFilter;
    private final Clock clock;

    public StatusSnapshot snapshot() {
        Map<String, TenantSummary> tenants = new LinkedHashMap<>();
        for (String tenantId : schedulingManager.knownTenants()) {
            tenants.put(tenantId, new TenantSummary(
                    schedulingManager.tenantState(tenantId),
                    schedulingManager.timerStatuses(tenantId)));
        }
        return StatusSnapshot.builder()
                .timestamp(clock.instant())
                .tenants(tenants)
                .totalActiveTimers(schedulingManager.totalActiveTimers())
                .cache(tenantCache.stats())
                .lockTableSize(executionLock.size())
                .dedupeTableSize(duplicateEventFilter.size())
                .build();
    }
}
