package com.insightops.dashboard.webhook;

import com.insightops.dashboard.config.DashboardProperties;
import com.insightops.dashboard.tenant.MissingTenantException;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Collapses redelivered webhook events within a fixed dedupe window.
 *
 * <p>This filter is the only idempotency gate for inbound events: handlers behind
 * it assume they never see the same (tenant, event type, event id) twice within
 * the window. Entries are kept for twice the window to tolerate ordering jitter of
 * at-least-once delivery, then swept.</p>
 */
@Slf4j
@Component
public class DuplicateEventFilter {

    /** Map of tenant id to first-seen instants keyed by {@code eventType:eventId}. */
    private final Map<String, Map<String, Instant>> seenEvents = new ConcurrentHashMap<>();

    private final DashboardProperties properties;
    private final Clock clock;
    private final ScheduledExecutorService sweepExecutor;

    public DuplicateEventFilter(DashboardProperties properties, Clock clock) {
        this.properties = properties;
        this.clock = clock;
        this.sweepExecutor = Executors.newSingleThreadScheduledExecutor();
    }

    @PostConstruct
    void start() {
        long sweepSeconds = properties.getDedupeSweepSeconds();
        sweepExecutor.scheduleAtFixedRate(this::sweep, sweepSeconds, sweepSeconds, TimeUnit.SECONDS);
    }

    @PreDestroy
    void stop() {
        sweepExecutor.shutdownNow();
    }

    /**
     * Atomically checks whether the event was already seen inside the window and,
     * if not, records it as seen now. A duplicate does not move the first-seen instant.
     */
    public DedupeResult checkAndMark(String tenantId, String eventType, String eventId) {
        MissingTenantException.require(tenantId, "dedupe check");
        if (eventId == null || eventId.isBlank()) {
            throw new IllegalArgumentException("Event id is required for dedupe check");
        }
        String eventKey = (eventType == null ? "event" : eventType) + ":" + eventId;
        Instant now = clock.instant();
        Duration window = window();
        AtomicReference<DedupeResult> result = new AtomicReference<>();

        seenEvents.compute(tenantId, (id, events) -> {
            Map<String, Instant> tenantEvents = events != null ? events : new ConcurrentHashMap<>();
            Instant firstSeen = tenantEvents.get(eventKey);
            if (firstSeen != null) {
                Duration elapsed = Duration.between(firstSeen, now);
                if (elapsed.compareTo(window) < 0) {
                    result.set(DedupeResult.duplicateOf(elapsed));
                    return tenantEvents;
                }
            }
            tenantEvents.put(eventKey, now);
            result.set(DedupeResult.firstSighting());
            return tenantEvents;
        });

        DedupeResult outcome = result.get();
        if (outcome.isDuplicate()) {
            log.info("Duplicate event ignored for tenant {}: {} ({} ms after first sighting, window {} ms)",
                    tenantId, eventKey, outcome.getTimeSinceFirstSeen().toMillis(), window.toMillis());
        }
        return outcome;
    }

    /**
     * Removes entries older than twice the dedupe window, then tenants left empty.
     *
     * @return number of removed entries
     */
    public int sweep() {
        Instant cutoff = clock.instant().minus(window().multipliedBy(2));
        AtomicInteger removed = new AtomicInteger();
        for (String tenantId : seenEvents.keySet()) {
            seenEvents.computeIfPresent(tenantId, (id, events) -> {
                events.values().removeIf(firstSeen -> {
                    boolean old = firstSeen.isBefore(cutoff);
                    if (old) {
                        removed.incrementAndGet();
                    }
                    return old;
                });
                return events.isEmpty() ? null : events;
            });
        }
        if (removed.get() > 0) {
            log.debug("Cleaned up {} old webhook entries from the dedupe table", removed.get());
        }
        return removed.get();
    }

    /** Number of tracked events across all tenants. */
    public int size() {
        return seenEvents.values().stream().mapToInt(Map::size).sum();
    }

    private Duration window() {
        return Duration.ofSeconds(properties.getDedupeWindowSeconds());
    }
}
