package com.insightops.dashboard.status;

import lombok.RequiredArgsConstructor;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * Actuator health contribution ({@code /actuator/health}, component "polling").
 * Always UP: configuration and upstream problems are per tenant and never make
 * the process unhealthy.
 */
@Component("polling")
@RequiredArgsConstructor
public class PollingHealthIndicator implements HealthIndicator {

    private final PollingStatusService pollingStatusService;

    @Override
    public Health health() {
        StatusSnapshot snapshot = pollingStatusService.snapshot();
        return Health.up()
                .withDetail("tenants", snapshot.getTenants().size())
                .withDetail("activeTimers", snapshot.getTotalActiveTimers())
                .withDetail("cacheHitRate", snapshot.getCache().getHitRate())
                .withDetail("cacheEntries", snapshot.getCache().getTotalEntries())
                .withDetail("lockTableSize", snapshot.getLockTableSize())
                .withDetail("dedupeTableSize", snapshot.getDedupeTableSize())
                .build();
    }
}
