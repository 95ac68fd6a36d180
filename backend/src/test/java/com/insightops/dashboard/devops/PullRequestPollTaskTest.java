package com.insightops.dashboard.devops;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.insightops.dashboard.MutableClock;
import com.insightops.dashboard.cache.TenantCache;
import com.insightops.dashboard.config.DashboardProperties;
import com.insightops.dashboard.tenant.DevOpsCredentials;
import com.insightops.dashboard.tenant.PollingSettings;
import com.insightops.dashboard.tenant.Tenant;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.Mockito;
import reactor.core.publisher.Mono;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Unit tests for {@link PullRequestPollTask}.
 */
class PullRequestPollTaskTest {

    private static final String RESPONSE = """
            {
              "count": 3,
              "value": [
                {
                  "pullRequestId": 101,
                  "title": "Fresh change",
                  "repository": {"name": "payments-api"},
                  "creationDate": "2025-02-28T09:00:00Z",
                  "sourceRefName": "refs/heads/feature/fresh",
                  "targetRefName": "refs/heads/main"
                },
                {
                  "pullRequestId": 102,
                  "title": "Stale change",
                  "repository": {"name": "payments-api"},
                  "creationDate": "2025-02-10T09:00:00Z",
                  "lastMergeCommit": {"committer": {"date": "2025-02-20T09:00:00Z"}},
                  "sourceRefName": "refs/heads/feature/stale",
                  "targetRefName": "refs/heads/main",
                  "createdBy": {"displayName": "Avery Quinn"},
                  "_links": {"web": {"href": "https://dev.azure.com/contoso/Payments/_git/payments-api/pullrequest/102"}}
                },
                {
                  "pullRequestId": 103,
                  "title": "Ancient change",
                  "repository": {"name": "ledger"},
                  "creationDate": "2024-06-01T09:00:00Z"
                }
              ]
            }
            """;

    private final ObjectMapper objectMapper = new ObjectMapper();

    private EndpointLoader endpointLoader;
    private AzureDevOpsApiClient apiClient;
    private TenantCache tenantCache;
    private PullRequestPollTask task;

    @BeforeEach
    void setUp() {
        MutableClock clock = MutableClock.startingAt("2025-03-01T10:00:00Z");
        DashboardProperties properties = new DashboardProperties();
        endpointLoader = Mockito.mock(EndpointLoader.class);
        when(endpointLoader.require(PullRequestPollTask.LIST_ACTIVE_PULL_REQUESTS))
                .thenReturn(EndpointDefinition.builder().name(PullRequestPollTask.LIST_ACTIVE_PULL_REQUESTS).build());
        apiClient = Mockito.mock(AzureDevOpsApiClient.class);
        tenantCache = new TenantCache(properties, clock);
        task = new PullRequestPollTask(endpointLoader, apiClient, tenantCache, properties, clock);
    }

    @Test
    @DisplayName("Pull requests without activity for 48 hours are idle")
    void idleDetection() throws Exception {
        PullRequestSummary summary = task.summarize(tenant(new PollingSettings()), objectMapper.readTree(RESPONSE));

        assertEquals(3, summary.getActiveCount());
        assertEquals(2, summary.getIdle().size());
        IdlePullRequest stale = summary.getIdle().get(0);
        assertEquals(102, stale.getId());
        assertEquals(9, stale.getIdleDays());
        assertEquals("feature/stale", stale.getSourceBranch());
        assertEquals("Avery Quinn", stale.getCreatedBy());
        assertEquals("https://dev.azure.com/contoso/Payments/_git/payments-api/pullrequest/102", stale.getUrl());
    }

    @Test
    @DisplayName("The idle filter drops pull requests created before the cutoff")
    void idleFilterDropsOldPullRequests() throws Exception {
        PollingSettings settings = PollingSettings.builder().idlePrFilterEnabled(true).idlePrMaxDays(90).build();

        PullRequestSummary summary = task.summarize(tenant(settings), objectMapper.readTree(RESPONSE));

        assertEquals(1, summary.getIdle().size());
        assertEquals(102, summary.getIdle().get(0).getId());
    }

    @Test
    @DisplayName("Without a web link the URL is built from the credentials")
    void urlFallback() throws Exception {
        PullRequestSummary summary = task.summarize(tenant(new PollingSettings()), objectMapper.readTree(RESPONSE));

        assertEquals("https://dev.azure.com/contoso/Payments/_git/ledger/pullrequest/103",
                summary.getIdle().get(1).getUrl());
    }

    @Test
    @DisplayName("run() caches the summary and a fresh cache entry skips the next upstream call")
    void runCachesSummary() throws Exception {
        JsonNode response = objectMapper.readTree(RESPONSE);
        when(apiClient.get(any(DevOpsCredentials.class), any(EndpointDefinition.class), anyMap()))
                .thenReturn(Mono.just(response));
        Tenant tenant = tenant(new PollingSettings());

        task.run(tenant);
        task.run(tenant);

        verify(apiClient, times(1)).get(any(DevOpsCredentials.class), any(EndpointDefinition.class), anyMap());
        Optional<PullRequestSummary> cached =
                tenantCache.get("contoso", "pullRequests:Payments", PullRequestSummary.class);
        assertTrue(cached.isPresent());
        assertEquals(2, cached.get().getIdle().size());
    }

    @Test
    @DisplayName("An upstream failure propagates and caches nothing")
    void upstreamFailurePropagates() {
        when(apiClient.get(any(DevOpsCredentials.class), any(EndpointDefinition.class), anyMap()))
                .thenReturn(Mono.error(new IllegalStateException("HTTP 503")));

        IllegalStateException e = assertThrows(IllegalStateException.class,
                () -> task.run(tenant(new PollingSettings())));

        assertEquals("HTTP 503", e.getMessage());
        assertTrue(tenantCache.get("contoso", "pullRequests:Payments").isEmpty());
    }

    private static Tenant tenant(PollingSettings settings) {
        return Tenant.builder()
                .id("contoso")
                .credentials(DevOpsCredentials.builder()
                        .organization("contoso")
                        .project("Payments")
                        .pat("pat-value")
                        .build())
                .polling(settings)
                .build();
    }
}
