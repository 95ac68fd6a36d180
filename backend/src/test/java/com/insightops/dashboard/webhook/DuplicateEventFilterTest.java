package com.insightops.dashboard.webhook;

import com.insightops.dashboard.MutableClock;
import com.insightops.dashboard.config.DashboardProperties;
import com.insightops.dashboard.tenant.MissingTenantException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Unit tests for {@link DuplicateEventFilter}.
 */
class DuplicateEventFilterTest {

    private MutableClock clock;
    private DuplicateEventFilter filter;

    @BeforeEach
    void setUp() {
        DashboardProperties properties = new DashboardProperties();
        properties.setDedupeWindowSeconds(60);
        clock = MutableClock.startingAt("2025-03-01T10:00:00Z");
        filter = new DuplicateEventFilter(properties, clock);
    }

    @Test
    @DisplayName("The first sighting passes, a repeat inside the window is a duplicate")
    void repeatInsideWindowIsDuplicate() {
        DedupeResult first = filter.checkAndMark("tenant-a", "workitem.updated", "evt-1");
        assertFalse(first.isDuplicate());
        assertNull(first.getTimeSinceFirstSeen());

        clock.advanceSeconds(20);
        DedupeResult second = filter.checkAndMark("tenant-a", "workitem.updated", "evt-1");

        assertTrue(second.isDuplicate());
        assertEquals(Duration.ofSeconds(20), second.getTimeSinceFirstSeen());
    }

    @Test
    @DisplayName("Duplicates do not extend the window")
    void duplicateDoesNotRefreshFirstSeen() {
        filter.checkAndMark("tenant-a", "build.complete", "evt-1");
        clock.advanceSeconds(50);
        assertTrue(filter.checkAndMark("tenant-a", "build.complete", "evt-1").isDuplicate());

        clock.advanceSeconds(11);
        assertFalse(filter.checkAndMark("tenant-a", "build.complete", "evt-1").isDuplicate());
    }

    @Test
    @DisplayName("The same event id is independent across tenants and event types")
    void partitionedByTenantAndType() {
        filter.checkAndMark("tenant-a", "workitem.created", "evt-1");

        assertFalse(filter.checkAndMark("tenant-b", "workitem.created", "evt-1").isDuplicate());
        assertFalse(filter.checkAndMark("tenant-a", "workitem.updated", "evt-1").isDuplicate());
        assertEquals(3, filter.size());
    }

    @Test
    @DisplayName("sweep() removes entries older than twice the window")
    void sweepRemovesOldEntries() {
        filter.checkAndMark("tenant-a", "workitem.created", "old");
        clock.advanceSeconds(100);
        filter.checkAndMark("tenant-a", "workitem.created", "recent");
        clock.advanceSeconds(21);

        assertEquals(1, filter.sweep());
        assertEquals(1, filter.size());
    }

    @Test
    @DisplayName("A missing tenant or event id is rejected without touching the table")
    void invalidInputIsRejected() {
        assertThrows(MissingTenantException.class, () -> filter.checkAndMark(null, "t", "evt"));
        assertThrows(IllegalArgumentException.class, () -> filter.checkAndMark("tenant-a", "t", " "));
        assertEquals(0, filter.size());
    }
}
