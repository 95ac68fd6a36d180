package com.insightops.dashboard.webhook;

import com.fasterxml.jackson.databind.JsonNode;
import com.insightops.dashboard.cache.TenantCache;
import com.insightops.dashboard.tenant.MissingTenantException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Applies accepted webhook events: evicts the cache entries the event makes stale
 * so the next poll or dashboard read fetches fresh data.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class WebhookEventHandler {

    private final TenantCache tenantCache;

    /**
     * @return number of evicted cache entries
     */
    public int handle(String tenantId, WebhookEventKind kind, String eventId, String eventType, JsonNode payload) {
        MissingTenantException.require(tenantId, "webhook handling");
        int evicted = 0;
        for (String resource : kind.getAffectedCacheResources()) {
            evicted += tenantCache.evictByPrefix(tenantId, resource);
        }
        log.info("Processed {} webhook for tenant {} (event {}, resource {}): {} cache entries evicted",
                eventType, tenantId, eventId, resourceId(payload), evicted);
        return evicted;
    }

    private static String resourceId(JsonNode payload) {
        return payload == null ? null : payload.path("resource").path("id").asText(null);
    }
}
