package com.insightops.dashboard.status;

import com.insightops.dashboard.MutableClock;
import com.insightops.dashboard.cache.TenantCache;
import com.insightops.dashboard.config.DashboardProperties;
import com.insightops.dashboard.job.JobType;
import com.insightops.dashboard.lock.ExecutionLock;
import com.insightops.dashboard.scheduling.SchedulingManager;
import com.insightops.dashboard.scheduling.TenantState;
import com.insightops.dashboard.scheduling.TimerStatus;
import com.insightops.dashboard.webhook.DuplicateEventFilter;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.Mockito;

import java.time.Instant;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.Mockito.when;

/**
 * Unit tests for {@link PollingStatusService}.
 */
class PollingStatusServiceTest {

    private MutableClock clock;
    private SchedulingManager schedulingManager;
    private TenantCache tenantCache;
    private ExecutionLock executionLock;
    private DuplicateEventFilter duplicateEventFilter;
    private PollingStatusService service;

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt("2025-03-01T10:00:00Z");
        DashboardProperties properties = new DashboardProperties();
        schedulingManager = Mockito.mock(SchedulingManager.class);
        tenantCache = new TenantCache(properties, clock);
        executionLock = new ExecutionLock(properties, clock);
        duplicateEventFilter = new DuplicateEventFilter(properties, clock);
        service = new PollingStatusService(schedulingManager, tenantCache, executionLock,
                duplicateEventFilter, clock);
    }

    @Test
    @DisplayName("snapshot() combines scheduler, cache, lock and dedupe state")
    void snapshotCombinesComponents() {
        TimerStatus timer = new TimerStatus("timer-1", "0 */10 * * *", true, 4,
                Instant.parse("2025-03-01T09:00:00Z"));
        when(schedulingManager.knownTenants()).thenReturn(Set.of("contoso"));
        when(schedulingManager.tenantState("contoso")).thenReturn(TenantState.RUNNING);
        when(schedulingManager.timerStatuses("contoso")).thenReturn(Map.of("pullRequests", timer));
        when(schedulingManager.totalActiveTimers()).thenReturn(1);
        tenantCache.set("contoso", "pullRequests:Payments", "summary");
        executionLock.acquire("contoso", JobType.PULL_REQUESTS);
        duplicateEventFilter.checkAndMark("contoso", "workitem.updated", "evt-1");

        StatusSnapshot snapshot = service.snapshot();

        assertEquals(clock.instant(), snapshot.getTimestamp());
        assertEquals(1, snapshot.getTotalActiveTimers());
        TenantSummary summary = snapshot.getTenants().get("contoso");
        assertEquals(TenantState.RUNNING, summary.getState());
        assertEquals(timer, summary.getTimers().get("pullRequests"));
        assertEquals(1, snapshot.getCache().getTotalEntries());
        assertEquals(1, snapshot.getLockTableSize());
        assertEquals(1, snapshot.getDedupeTableSize());
    }

    @Test
    @DisplayName("An idle process reports empty tables")
    void emptySnapshot() {
        when(schedulingManager.knownTenants()).thenReturn(Set.of());

        StatusSnapshot snapshot = service.snapshot();

        assertEquals(0, snapshot.getTenants().size());
        assertEquals("0%", snapshot.getCache().getHitRate());
        assertEquals(0, snapshot.getLockTableSize());
    }
}
