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
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Lists active pull requests and keeps the ones without activity for more than
 * {@value #IDLE_HOURS} hours. With the tenant's idle filter on, pull requests created
 * more than {@code idlePrMaxDays} ago are ignored.
 *
 * <p>The summary is cached under {@code pullRequests:<project>}; while a cached
 * summary is still fresh the upstream call is skipped.</p>
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class PullRequestPollTask implements PollingTask {

    static final String LIST_ACTIVE_PULL_REQUESTS = "list_active_pull_requests";
    static final long IDLE_HOURS = 48;

    private final EndpointLoader endpointLoader;
    private final AzureDevOpsApiClient apiClient;
    private final TenantCache tenantCache;
    private final DashboardProperties properties;
    private final Clock clock;

    @Override
    public JobType jobType() {
        return JobType.PULL_REQUESTS;
    }

    @Override
    public void run(Tenant tenant) {
        DevOpsCredentials credentials = tenant.getCredentials();
        String cacheKey = CacheKeys.forProject(CacheKeys.PULL_REQUESTS, credentials.getProject());

        Optional<PullRequestSummary> cached = tenantCache.get(tenant.getId(), cacheKey, PullRequestSummary.class);
        if (cached.isPresent()) {
            log.debug("Pull requests of tenant {} served from cache (fetched at {})",
                    tenant.getId(), cached.get().getFetchedAt());
            return;
        }

        log.info("Polling pull requests for tenant {} ({}/{})",
                tenant.getId(), credentials.getOrganization(), credentials.getProject());
        JsonNode response = apiClient.get(credentials, endpointLoader.require(LIST_ACTIVE_PULL_REQUESTS),
                        Collections.emptyMap())
                .block(Duration.ofSeconds(properties.getUpstreamTimeoutSeconds()));

        PullRequestSummary summary = summarize(tenant, response);
        tenantCache.set(tenant.getId(), cacheKey, summary);

        if (!summary.getIdle().isEmpty()) {
            log.warn("Found {} idle pull requests for tenant {}", summary.getIdle().size(), tenant.getId());
        }
    }

    PullRequestSummary summarize(Tenant tenant, JsonNode response) {
        Instant now = clock.instant();
        Instant idleSince = now.minus(Duration.ofHours(IDLE_HOURS));
        PollingSettings settings = tenant.getPolling();
        Instant createdCutoff = settings.isIdlePrFilterActive()
                ? now.minus(Duration.ofDays(settings.resolvedIdlePrMaxDays()))
                : null;

        JsonNode items = response == null ? null : response.path("value");
        int active = 0;
        int filtered = 0;
        List<IdlePullRequest> idle = new ArrayList<>();
        if (items != null && items.isArray()) {
            for (JsonNode pr : items) {
                active++;
                Instant created = parseInstant(pr.path("creationDate").asText(null));
                Instant lastActivity = Optional.ofNullable(
                                parseInstant(pr.path("lastMergeCommit").path("committer").path("date").asText(null)))
                        .orElse(created);
                if (lastActivity == null || !lastActivity.isBefore(idleSince)) {
                    continue;
                }
                if (createdCutoff != null && created != null && created.isBefore(createdCutoff)) {
                    filtered++;
                    continue;
                }
                idle.add(toIdlePullRequest(tenant.getCredentials(), pr, created,
                        Duration.between(lastActivity, now).toDays()));
            }
        }
        if (createdCutoff != null && filtered > 0) {
            log.info("Ignored {} idle pull requests of tenant {} older than {} days",
                    filtered, tenant.getId(), settings.resolvedIdlePrMaxDays());
        }
        return new PullRequestSummary(tenant.getCredentials().getProject(), active, List.copyOf(idle), now);
    }

    private static IdlePullRequest toIdlePullRequest(DevOpsCredentials credentials, JsonNode pr,
                                                     Instant created, long idleDays) {
        int id = pr.path("pullRequestId").asInt();
        String repository = pr.path("repository").path("name").asText("Unknown");
        String url = pr.path("_links").path("web").path("href").asText(null);
        if (url == null) {
            url = credentials.resolvedBaseUrl() + "/" + credentials.getOrganization() + "/"
                    + credentials.getProject() + "/_git/" + repository + "/pullrequest/" + id;
        }
        return IdlePullRequest.builder()
                .id(id)
                .title(pr.path("title").asText("No title"))
                .repository(repository)
                .sourceBranch(branchName(pr.path("sourceRefName").asText(null)))
                .targetBranch(branchName(pr.path("targetRefName").asText(null)))
                .createdBy(pr.path("createdBy").path("displayName").asText("Unknown"))
                .createdDate(created)
                .idleDays(idleDays)
                .url(url)
                .build();
    }

    private static String branchName(String ref) {
        return ref == null ? "unknown" : ref.replace("refs/heads/", "");
    }

    private static Instant parseInstant(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return Instant.parse(value);
        } catch (DateTimeParseException e) {
            log.debug("Unparseable timestamp {} in pull request payload", value);
            return null;
        }
    }
}
