package com.insightops.dashboard.status;

import com.insightops.dashboard.cache.CacheStats;
import com.insightops.dashboard.cache.TenantCache;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Cache statistics and manual invalidation.
 */
@Slf4j
@RestController
@RequestMapping("/api/cache")
@RequiredArgsConstructor
public class CacheController {

    private final TenantCache tenantCache;

    @GetMapping("/stats")
    public CacheStats stats() {
        return tenantCache.stats();
    }

    @PostMapping("/tenants/{tenantId}/invalidate")
    public Map<String, Object> invalidateTenant(@PathVariable String tenantId) {
        tenantCache.invalidateTenant(tenantId);
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("message", "Tenant cache invalidated");
        body.put("tenantId", tenantId);
        return body;
    }

    @PostMapping("/clear-all")
    public Map<String, Object> clearAll() {
        log.warn("Clearing the cache of every tenant on request");
        tenantCache.clearAll();
        return Map.of("message", "All tenant caches cleared");
    }
}
