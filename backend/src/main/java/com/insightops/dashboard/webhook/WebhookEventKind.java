package com.insightops.dashboard.webhook;

import com.insightops.dashboard.cache.CacheKeys;
import lombok.Getter;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * Webhook routes accepted under {@code /api/webhooks/org/{organizationId}/{resource}/{action}},
 * with the Azure DevOps event type assumed when the payload carries none and the
 * cache resources the event makes stale.
 */
@Getter
public enum WebhookEventKind {

    WORK_ITEM_CREATED("workitem", "created", "workitem.created",
            List.of(CacheKeys.WORK_ITEMS, CacheKeys.OVERDUE_WORK_ITEMS)),
    WORK_ITEM_UPDATED("workitem", "updated", "workitem.updated",
            List.of(CacheKeys.WORK_ITEMS, CacheKeys.OVERDUE_WORK_ITEMS)),
    BUILD_COMPLETED("build", "completed", "build.complete",
            List.of(CacheKeys.BUILDS)),
    PULL_REQUEST_CREATED("pullrequest", "created", "git.pullrequest.created",
            List.of(CacheKeys.PULL_REQUESTS)),
    RELEASE_DEPLOYMENT("release", "deployment", "ms.vss-release.deployment-completed-event",
            List.of(CacheKeys.RELEASES));

    private final String resource;
    private final String action;
    private final String defaultEventType;
    private final List<String> affectedCacheResources;

    WebhookEventKind(String resource, String action, String defaultEventType, List<String> affectedCacheResources) {
        this.resource = resource;
        this.action = action;
        this.defaultEventType = defaultEventType;
        this.affectedCacheResources = affectedCacheResources;
    }

    /** Route form, e.g. {@code workitem/created}. */
    public String getRoute() {
        return resource + "/" + action;
    }

    public static Optional<WebhookEventKind> fromPath(String resource, String action) {
        return Arrays.stream(values())
                .filter(kind -> kind.resource.equalsIgnoreCase(resource) && kind.action.equalsIgnoreCase(action))
                .findFirst();
    }
}
