package com.insightops.dashboard.lock;

import com.insightops.dashboard.config.DashboardProperties;
import com.insightops.dashboard.job.JobType;
import com.insightops.dashboard.tenant.MissingTenantException;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Process-wide registry preventing two runs of the same (tenant, job type) from overlapping.
 *
 * <p>This is a non-blocking mutual-exclusion primitive, not a queue: a caller that
 * fails to acquire simply skips its run. Entries left behind by a run that never
 * released are reclaimed by a periodic sweep once they exceed
 * {@link DashboardProperties#getLockMaxRunSeconds()}.</p>
 */
@Slf4j
@Component
public class ExecutionLock {

    private final Map<LockKey, LockEntry> locks = new ConcurrentHashMap<>();
    private final DashboardProperties properties;
    private final Clock clock;
    private final ScheduledExecutorService sweepExecutor;

    public ExecutionLock(DashboardProperties properties, Clock clock) {
        this.properties = properties;
        this.clock = clock;
        this.sweepExecutor = Executors.newSingleThreadScheduledExecutor();
    }

    @PostConstruct
    void start() {
        long sweepSeconds = properties.getLockSweepSeconds();
        sweepExecutor.scheduleAtFixedRate(this::sweepStale, sweepSeconds, sweepSeconds, TimeUnit.SECONDS);
        log.info("Execution lock sweep every {}s, max run duration {}s",
                sweepSeconds, properties.getLockMaxRunSeconds());
    }

    @PreDestroy
    void stop() {
        sweepExecutor.shutdownNow();
    }

    /**
     * Tries to take the lock for the given key.
     *
     * @return a fresh execution id, or {@code null} if a run already holds the lock
     */
    public String acquire(String tenantId, JobType jobType) {
        MissingTenantException.require(tenantId, "lock acquire");
        LockEntry candidate = new LockEntry(tenantId, jobType, UUID.randomUUID().toString(), clock.instant());
        LockEntry existing = locks.putIfAbsent(new LockKey(tenantId, jobType), candidate);
        if (existing != null) {
            log.debug("Lock for {}/{} held by execution {} since {}",
                    tenantId, jobType.getKey(), existing.getExecutionId(), existing.getAcquiredAt());
            return null;
        }
        return candidate.getExecutionId();
    }

    /**
     * Releases the lock only if it is still held by {@code executionId}. A release
     * from a run whose lock was already reclaimed (and possibly re-acquired) is a no-op.
     *
     * @return whether an entry was removed
     */
    public boolean release(String tenantId, JobType jobType, String executionId) {
        MissingTenantException.require(tenantId, "lock release");
        LockKey key = new LockKey(tenantId, jobType);
        LockEntry current = locks.get(key);
        if (current == null || !current.getExecutionId().equals(executionId)) {
            log.debug("Ignoring release of {}/{} by execution {}: not the current holder",
                    tenantId, jobType.getKey(), executionId);
            return false;
        }
        return locks.remove(key, current);
    }

    public boolean isLocked(String tenantId, JobType jobType) {
        MissingTenantException.require(tenantId, "lock lookup");
        return locks.containsKey(new LockKey(tenantId, jobType));
    }

    /**
     * Removes every entry older than the configured maximum run duration.
     *
     * @return number of reclaimed entries
     */
    public int sweepStale() {
        Instant cutoff = clock.instant().minus(Duration.ofSeconds(properties.getLockMaxRunSeconds()));
        int reclaimed = 0;
        for (Map.Entry<LockKey, LockEntry> entry : locks.entrySet()) {
            LockEntry lock = entry.getValue();
            if (lock.getAcquiredAt().isBefore(cutoff) && locks.remove(entry.getKey(), lock)) {
                reclaimed++;
                log.warn("Reclaimed stale lock for {}/{} (execution {}, acquired at {}); "
                                + "the previous run likely crashed or ran abnormally long",
                        lock.getTenantId(), lock.getJobType().getKey(), lock.getExecutionId(), lock.getAcquiredAt());
            }
        }
        return reclaimed;
    }

    public int size() {
        return locks.size();
    }

    /** Read-only copy of the current lock table. */
    public List<LockEntry> snapshot() {
        return List.copyOf(locks.values());
    }

    @Value
    private static class LockKey {
        String tenantId;
        JobType jobType;
    }
}
