package com.insightops.dashboard.cache;

import com.insightops.dashboard.MutableClock;
import com.insightops.dashboard.config.DashboardProperties;
import com.insightops.dashboard.tenant.MissingTenantException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Unit tests for {@link TenantCache}.
 */
class TenantCacheTest {

    private MutableClock clock;
    private TenantCache cache;

    @BeforeEach
    void setUp() {
        DashboardProperties properties = new DashboardProperties();
        properties.setCacheDefaultTtlSeconds(60);
        clock = MutableClock.startingAt("2025-03-01T10:00:00Z");
        cache = new TenantCache(properties, clock);
    }

    @Nested
    @DisplayName("Tenant isolation")
    class Isolation {

        @Test
        @DisplayName("A value set for one tenant is never visible to another")
        void valuesDoNotLeakAcrossTenants() {
            cache.set("tenant-a", "pullRequests:Payments", "A's data");

            assertEquals(Optional.of("A's data"), cache.get("tenant-a", "pullRequests:Payments"));
            assertTrue(cache.get("tenant-b", "pullRequests:Payments").isEmpty());
        }

        @Test
        @DisplayName("invalidateTenant() leaves other tenants untouched")
        void invalidateIsScoped() {
            cache.set("tenant-a", "k", 1);
            cache.set("tenant-b", "k", 2);

            cache.invalidateTenant("tenant-a");

            assertTrue(cache.get("tenant-a", "k").isEmpty());
            assertEquals(Optional.of(2), cache.get("tenant-b", "k"));
        }

        @Test
        @DisplayName("Every operation rejects a missing tenant id")
        void missingTenantFailsClosed() {
            cache.set("tenant-a", "k", 1);

            assertThrows(MissingTenantException.class, () -> cache.get(null, "k"));
            assertThrows(MissingTenantException.class, () -> cache.get("", "k"));
            assertThrows(MissingTenantException.class, () -> cache.set(null, "k", 1));
            assertThrows(MissingTenantException.class, () -> cache.invalidateTenant(" "));
            assertThrows(MissingTenantException.class, () -> cache.evictByPrefix(null, "k"));
            assertEquals(1, cache.stats().getTotalEntries());
        }
    }

    @Nested
    @DisplayName("Expiry")
    class Expiry {

        @Test
        @DisplayName("An entry is served until its TTL elapses, then reads as a miss")
        void entryExpiresAfterTtl() {
            cache.set("tenant-a", "k", "v", 30);

            clock.advanceSeconds(30);
            assertTrue(cache.get("tenant-a", "k").isPresent());

            clock.advanceSeconds(1);
            assertTrue(cache.get("tenant-a", "k").isEmpty());
            assertEquals(0, cache.stats().getTotalEntries());
        }

        @Test
        @DisplayName("set() without TTL uses the configured default")
        void defaultTtlApplies() {
            cache.set("tenant-a", "k", "v");

            clock.advanceSeconds(61);
            assertTrue(cache.get("tenant-a", "k").isEmpty());
        }

        @Test
        @DisplayName("sweep() drops expired entries and tenants left empty")
        void sweepRemovesExpiredEntriesAndEmptyTenants() {
            cache.set("tenant-a", "short", "v", 10);
            cache.set("tenant-b", "short", "v", 10);
            cache.set("tenant-b", "long", "v", 120);

            clock.advanceSeconds(11);

            assertEquals(2, cache.sweep());
            CacheStats stats = cache.stats();
            assertEquals(1, stats.getTenants());
            assertEquals(1, stats.getTotalEntries());
        }

        @Test
        @DisplayName("set() overwrites the previous value and TTL")
        void setOverwrites() {
            cache.set("tenant-a", "k", "old", 10);
            cache.set("tenant-a", "k", "new", 100);

            clock.advanceSeconds(50);
            assertEquals(Optional.of("new"), cache.get("tenant-a", "k"));
        }
    }

    @Test
    @DisplayName("evictByPrefix() removes a resource for every project of the tenant")
    void evictByPrefixRemovesMatchingKeys() {
        cache.set("tenant-a", CacheKeys.forProject(CacheKeys.PULL_REQUESTS, "Payments"), "x");
        cache.set("tenant-a", CacheKeys.forProject(CacheKeys.PULL_REQUESTS, "Billing"), "y");
        cache.set("tenant-a", CacheKeys.forProject(CacheKeys.WORK_ITEMS, "Payments"), "z");
        cache.set("tenant-b", CacheKeys.forProject(CacheKeys.PULL_REQUESTS, "Payments"), "other");

        assertEquals(2, cache.evictByPrefix("tenant-a", CacheKeys.PULL_REQUESTS));
        assertTrue(cache.get("tenant-a", "workItems:Payments").isPresent());
        assertTrue(cache.get("tenant-b", "pullRequests:Payments").isPresent());
    }

    @Test
    @DisplayName("Typed get() treats a value of another type as absent")
    void typedGetFiltersByType() {
        cache.set("tenant-a", "k", 42);

        assertEquals(Optional.of(42), cache.get("tenant-a", "k", Integer.class));
        assertFalse(cache.get("tenant-a", "k", String.class).isPresent());
    }

    @Test
    @DisplayName("stats() counts hits, misses and sets and formats the hit rate")
    void statsTrackCounters() {
        assertEquals("0%", cache.stats().getHitRate());

        cache.set("tenant-a", "k", "v");
        cache.get("tenant-a", "k");
        cache.get("tenant-a", "k");
        cache.get("tenant-a", "k");
        cache.get("tenant-a", "missing");

        CacheStats stats = cache.stats();
        assertEquals(3, stats.getHits());
        assertEquals(1, stats.getMisses());
        assertEquals(1, stats.getSets());
        assertEquals("75.0%", stats.getHitRate());
    }

    @Test
    @DisplayName("clearAll() empties every tenant")
    void clearAllEmptiesCache() {
        cache.set("tenant-a", "k", 1);
        cache.set("tenant-b", "k", 2);

        cache.clearAll();

        assertEquals(0, cache.stats().getTenants());
    }
}
