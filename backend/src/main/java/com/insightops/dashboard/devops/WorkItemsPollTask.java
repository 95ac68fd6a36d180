package com.insightops.dashboard.devops;

import com.fasterxml.jackson.databind.JsonNode;
import com.insightops.dashboard.cache.CacheKeys;
import com.insightops.dashboard.cache.TenantCache;
import com.insightops.dashboard.config.DashboardProperties;
import com.insightops.dashboard.job.JobType;
import com.insightops.dashboard.scheduling.PollingTask;
import com.insightops.dashboard.tenant.DevOpsCredentials;
import com.insightops.dashboard.tenant.Tenant;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.util.Collections;
import java.util.List;

/**
 * Polls the work items changed since yesterday and caches their summary
 * under {@code workItems:<project>}.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class WorkItemsPollTask implements PollingTask {

    private final EndpointLoader endpointLoader;
    private final AzureDevOpsApiClient apiClient;
    private final TenantCache tenantCache;
    private final DashboardProperties properties;
    private final Clock clock;

    @Override
    public JobType jobType() {
        return JobType.WORK_ITEMS;
    }

    @Override
    public void run(Tenant tenant) {
        DevOpsCredentials credentials = tenant.getCredentials();
        log.info("Polling work items for tenant {} ({}/{})",
                tenant.getId(), credentials.getOrganization(), credentials.getProject());

        JsonNode response = apiClient.post(credentials, endpointLoader.require(WiqlQueries.QUERY_WORK_ITEMS),
                        Collections.emptyMap(), WiqlQueries.recentlyChanged())
                .block(Duration.ofSeconds(properties.getUpstreamTimeoutSeconds()));

        List<Integer> ids = WiqlQueries.workItemIds(response);
        WorkItemSummary summary = new WorkItemSummary(credentials.getProject(), ids.size(), ids, clock.instant());
        tenantCache.set(tenant.getId(), CacheKeys.forProject(CacheKeys.WORK_ITEMS, credentials.getProject()), summary);

        if (!ids.isEmpty()) {
            log.info("Found {} recently changed work items for tenant {}", ids.size(), tenant.getId());
        }
    }
}
