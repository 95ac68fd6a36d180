package com.insightops.dashboard.cache;

import com.insightops.dashboard.config.DashboardProperties;
import com.insightops.dashboard.tenant.MissingTenantException;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Short-TTL memoization of expensive upstream calls, partitioned by tenant.
 *
 * <p>Layout is {@code tenantId -> key -> entry}. No lookup ever crosses the
 * tenant boundary, and every operation rejects a missing tenant id with
 * {@link MissingTenantException} instead of falling back to shared state.</p>
 *
 * <p>Expired entries are dropped lazily on read and by a periodic sweep that
 * also removes tenants left without entries.</p>
 */
@Slf4j
@Component
public class TenantCache {

    /** Map of tenant id to that tenant's entries. */
    private final Map<String, Map<String, CacheEntry>> cache = new ConcurrentHashMap<>();

    private final AtomicLong hits = new AtomicLong();
    private final AtomicLong misses = new AtomicLong();
    private final AtomicLong sets = new AtomicLong();

    private final DashboardProperties properties;
    private final Clock clock;
    private final ScheduledExecutorService sweepExecutor;

    public TenantCache(DashboardProperties properties, Clock clock) {
        this.properties = properties;
        this.clock = clock;
        this.sweepExecutor = Executors.newSingleThreadScheduledExecutor();
    }

    @PostConstruct
    void start() {
        long sweepSeconds = properties.getCacheSweepSeconds();
        sweepExecutor.scheduleAtFixedRate(this::sweep, sweepSeconds, sweepSeconds, TimeUnit.SECONDS);
    }

    @PreDestroy
    void stop() {
        sweepExecutor.shutdownNow();
    }

    /**
     * Returns the live value cached under {@code key} for the tenant.
     *
     * @return the value, or empty on a miss or an expired entry
     */
    public Optional<Object> get(String tenantId, String key) {
        MissingTenantException.require(tenantId, "cache get");
        Map<String, CacheEntry> tenantEntries = cache.get(tenantId);
        CacheEntry entry = tenantEntries == null ? null : tenantEntries.get(key);
        if (entry == null) {
            misses.incrementAndGet();
            return Optional.empty();
        }
        if (entry.isExpired(clock.instant())) {
            tenantEntries.remove(key, entry);
            misses.incrementAndGet();
            return Optional.empty();
        }
        hits.incrementAndGet();
        log.debug("Cache hit for tenant {}: {}", tenantId, key);
        return Optional.of(entry.getValue());
    }

    /**
     * Typed variant of {@link #get(String, String)}. A value of another type counts as a miss.
     */
    public <T> Optional<T> get(String tenantId, String key, Class<T> type) {
        return get(tenantId, key)
                .filter(type::isInstance)
                .map(type::cast);
    }

    /** Caches the value with the configured default TTL. */
    public void set(String tenantId, String key, Object value) {
        set(tenantId, key, value, properties.getCacheDefaultTtlSeconds());
    }

    /**
     * Caches the value, replacing any existing entry for the key.
     */
    public void set(String tenantId, String key, Object value, long ttlSeconds) {
        MissingTenantException.require(tenantId, "cache set");
        Objects.requireNonNull(value, "cached value must not be null");
        CacheEntry entry = new CacheEntry(value, clock.instant().plus(Duration.ofSeconds(ttlSeconds)));
        // compute keeps the put atomic with respect to the sweep dropping an empty tenant map
        cache.compute(tenantId, (id, entries) -> {
            Map<String, CacheEntry> target = entries != null ? entries : new ConcurrentHashMap<>();
            target.put(key, entry);
            return target;
        });
        sets.incrementAndGet();
        log.debug("Cache set for tenant {}: {} (TTL: {}s)", tenantId, key, ttlSeconds);
    }

    public void evict(String tenantId, String key) {
        MissingTenantException.require(tenantId, "cache evict");
        Map<String, CacheEntry> tenantEntries = cache.get(tenantId);
        if (tenantEntries != null) {
            tenantEntries.remove(key);
        }
    }

    /**
     * Drops every entry of the tenant whose key starts with {@code prefix}.
     *
     * @return number of evicted entries
     */
    public int evictByPrefix(String tenantId, String prefix) {
        MissingTenantException.require(tenantId, "cache evict");
        Map<String, CacheEntry> tenantEntries = cache.get(tenantId);
        if (tenantEntries == null) {
            return 0;
        }
        AtomicInteger evicted = new AtomicInteger();
        tenantEntries.keySet().removeIf(key -> {
            boolean matches = key.startsWith(prefix);
            if (matches) {
                evicted.incrementAndGet();
            }
            return matches;
        });
        return evicted.get();
    }

    /** Drops every entry of the tenant, e.g. after its upstream credentials change. */
    public void invalidateTenant(String tenantId) {
        MissingTenantException.require(tenantId, "cache invalidate");
        if (cache.remove(tenantId) != null) {
            log.info("Invalidated cache for tenant {}", tenantId);
        }
    }

    public void clearAll() {
        cache.clear();
        log.info("All tenant caches cleared");
    }

    /**
     * Removes expired entries across all tenants, then tenants with no entries left.
     *
     * @return number of removed entries
     */
    public int sweep() {
        Instant now = clock.instant();
        AtomicInteger removed = new AtomicInteger();
        for (String tenantId : cache.keySet()) {
            cache.computeIfPresent(tenantId, (id, entries) -> {
                entries.entrySet().removeIf(e -> {
                    boolean expired = e.getValue().isExpired(now);
                    if (expired) {
                        removed.incrementAndGet();
                    }
                    return expired;
                });
                return entries.isEmpty() ? null : entries;
            });
        }
        if (removed.get() > 0) {
            log.debug("Swept {} expired cache entries", removed.get());
        }
        return removed.get();
    }

    public CacheStats stats() {
        long hitCount = hits.get();
        long missCount = misses.get();
        long lookups = hitCount + missCount;
        String hitRate = lookups > 0
                ? String.format(Locale.ROOT, "%.1f%%", hitCount * 100.0 / lookups)
                : "0%";
        int totalEntries = cache.values().stream().mapToInt(Map::size).sum();
        return new CacheStats(hitCount, missCount, sets.get(), hitRate, cache.size(), totalEntries);
    }
}
