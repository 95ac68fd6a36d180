package com.insightops.dashboard.devops;

import com.fasterxml.jackson.databind.JsonNode;
import com.insightops.dashboard.cache.CacheKeys;
import com.insightops.dashboard.cache.TenantCache;
import com.insightops.dashboard.config.DashboardProperties;
import com.insightops.dashboard.job.JobType;
import com.insightops.dashboard.scheduling.PollingTask;
import com.insightops.dashboard.tenant.DevOpsCredentials;
import com.insightops.dashboard.tenant.PollingSettings;
import com.insightops.dashboard.tenant.Tenant;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.util.Collections;
import java.util.List;

/**
 * Finds open work items past their due date. When the tenant's overdue filter is
 * active, items overdue for longer than {@code overdueMaxDays} are left out.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class OverdueCheckTask implements PollingTask {

    private final EndpointLoader endpointLoader;
    private final AzureDevOpsApiClient apiClient;
    private final TenantCache tenantCache;
    private final DashboardProperties properties;
    private final Clock clock;

    @Override
    public JobType jobType() {
        return JobType.OVERDUE;
    }

    @Override
    public void run(Tenant tenant) {
        DevOpsCredentials credentials = tenant.getCredentials();
        PollingSettings settings = tenant.getPolling();
        int maxDays = settings.isOverdueFilterActive() ? settings.resolvedOverdueMaxDays() : 0;
        log.info("Checking overdue work items for tenant {} (max {} days overdue)",
                tenant.getId(), maxDays > 0 ? maxDays : "unbounded");

        JsonNode response = apiClient.post(credentials, endpointLoader.require(WiqlQueries.QUERY_WORK_ITEMS),
                        Collections.emptyMap(), WiqlQueries.overdue(maxDays))
                .block(Duration.ofSeconds(properties.getUpstreamTimeoutSeconds()));

        List<Integer> ids = WiqlQueries.workItemIds(response);
        WorkItemSummary summary = new WorkItemSummary(credentials.getProject(), ids.size(), ids, clock.instant());
        tenantCache.set(tenant.getId(),
                CacheKeys.forProject(CacheKeys.OVERDUE_WORK_ITEMS, credentials.getProject()), summary);

        if (!ids.isEmpty()) {
            log.warn("Found {} overdue work items for tenant {}", ids.size(), tenant.getId());
        }
    }
}
