package com.insightops.dashboard.scheduling;

import com.insightops.dashboard.config.DashboardProperties;
import com.insightops.dashboard.job.JobConfig;
import com.insightops.dashboard.job.JobResult;
import com.insightops.dashboard.job.JobSpec;
import com.insightops.dashboard.job.JobStore;
import com.insightops.dashboard.job.JobType;
import com.insightops.dashboard.lock.ExecutionLock;
import com.insightops.dashboard.tenant.MissingTenantException;
import com.insightops.dashboard.tenant.PollingSettings;
import com.insightops.dashboard.tenant.Tenant;
import com.insightops.dashboard.tenant.TenantDirectory;
import jakarta.annotation.PreDestroy;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.scheduling.support.CronTrigger;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.ZoneId;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Owns every recurring polling timer of every tenant.
 *
 * <p>Per tenant it keeps at most one {@link ActiveTimer} per {@link JobType},
 * reconciled against the {@link JobStore} on start and against settings patches
 * on update. Start, update and stop for one tenant never overlap: a second call
 * arriving while one is in progress returns {@link SetupOutcome#ALREADY_IN_PROGRESS}.</p>
 *
 * <p>Each tick takes the {@link ExecutionLock} for its (tenant, job type), records
 * the run in the job store, runs the registered {@link PollingTask} and always
 * releases the lock afterwards. A tick that cannot take the lock is dropped.</p>
 */
@Slf4j
@Service
public class SchedulingManager {

    private final TaskScheduler taskScheduler;
    private final JobStore jobStore;
    private final TenantDirectory tenantDirectory;
    private final ExecutionLock executionLock;
    private final TaskRegistry taskRegistry;
    private final Clock clock;
    private final ZoneId zone;

    /** tenant -> job type -> live timer */
    private final Map<String, Map<JobType, ActiveTimer>> timers = new ConcurrentHashMap<>();

    private final Set<String> setupInProgress = ConcurrentHashMap.newKeySet();

    private final Map<String, TenantState> states = new ConcurrentHashMap<>();

    /** Latest tenant record handed to tasks on every tick */
    private final Map<String, Tenant> tenantSnapshots = new ConcurrentHashMap<>();

    private final AtomicBoolean initialized = new AtomicBoolean();

    public SchedulingManager(@Qualifier("pollingTaskScheduler") TaskScheduler taskScheduler,
                             JobStore jobStore,
                             TenantDirectory tenantDirectory,
                             ExecutionLock executionLock,
                             TaskRegistry taskRegistry,
                             DashboardProperties properties,
                             Clock clock) {
        this.taskScheduler = taskScheduler;
        this.jobStore = jobStore;
        this.tenantDirectory = tenantDirectory;
        this.executionLock = executionLock;
        this.taskRegistry = taskRegistry;
        this.clock = clock;
        this.zone = ZoneId.of(properties.getTimeZone());
    }

    // ---------------------------------------------------------------------
    // Lifecycle
    // ---------------------------------------------------------------------

    /**
     * Replaces every timer of the tenant with one timer per enabled job type.
     * Unknown, inactive or credential-less tenants are skipped without touching
     * their existing timers.
     */
    public SetupOutcome startTenant(String tenantId) {
        MissingTenantException.require(tenantId, "polling start");
        if (!beginSetup(tenantId, "start")) {
            return SetupOutcome.ALREADY_IN_PROGRESS;
        }
        try {
            TenantLookup lookup = lookupEligibleTenant(tenantId);
            if (lookup.getRejection() != null) {
                return lookup.getRejection();
            }
            return doStart(lookup.getTenant());
        } finally {
            setupInProgress.remove(tenantId);
        }
    }

    /**
     * Applies a settings patch. The patch is merged over the stored settings and
     * persisted; then only the job types whose {enabled, schedule} changed get
     * their timer replaced. A tenant that is not running is started instead.
     */
    public SetupOutcome updateTenant(String tenantId, PollingSettings patch) {
        MissingTenantException.require(tenantId, "polling update");
        if (!beginSetup(tenantId, "update")) {
            return SetupOutcome.ALREADY_IN_PROGRESS;
        }
        try {
            TenantLookup lookup = lookupEligibleTenant(tenantId);
            if (lookup.getRejection() != null) {
                return lookup.getRejection();
            }

            PollingSettings merged = lookup.getTenant().getPolling().mergedWith(patch);
            Tenant tenant = lookup.getTenant().toBuilder().polling(merged).build();
            try {
                tenantDirectory.updatePollingSettings(tenantId, merged);
            } catch (RuntimeException e) {
                log.error("Failed to persist polling settings for tenant {}", tenantId, e);
                return SetupOutcome.FAILED;
            }

            if (tenantState(tenantId) != TenantState.RUNNING) {
                log.info("Tenant {} is not running, starting it with the updated settings", tenantId);
                return doStart(tenant);
            }
            return doUpdate(tenant);
        } finally {
            setupInProgress.remove(tenantId);
        }
    }

    /**
     * Destroys every timer of the tenant and pauses its jobs. In-flight ticks finish.
     */
    public SetupOutcome stopTenant(String tenantId) {
        MissingTenantException.require(tenantId, "polling stop");
        if (!beginSetup(tenantId, "stop")) {
            return SetupOutcome.ALREADY_IN_PROGRESS;
        }
        try {
            boolean tracked = states.containsKey(tenantId) || timers.containsKey(tenantId);
            if (tracked) {
                states.put(tenantId, TenantState.STOPPING);
            }
            int destroyed = destroyTimers(tenantId);
            tenantSnapshots.remove(tenantId);
            try {
                jobStore.pauseJobs(tenantId);
            } catch (RuntimeException e) {
                log.warn("Failed to pause jobs of tenant {}: {}", tenantId, e.getMessage());
            }
            if (!tracked) {
                log.info("Stop requested for tenant {} which is not scheduled, no state recorded", tenantId);
                return SetupOutcome.STOPPED;
            }
            states.put(tenantId, TenantState.STOPPED);
            log.info("Stopped polling for tenant {} ({} timer(s) destroyed)", tenantId, destroyed);
            return SetupOutcome.STOPPED;
        } finally {
            setupInProgress.remove(tenantId);
        }
    }

    /**
     * Stops every timer of every tenant, then clears all in-process tables.
     * Failures to cancel individual timers are logged and skipped.
     *
     * @return number of timers stopped cleanly
     */
    public int emergencyStopAll() {
        int stopped = 0;
        int total = 0;
        for (Map<JobType, ActiveTimer> tenantTimers : timers.values()) {
            for (ActiveTimer timer : tenantTimers.values()) {
                total++;
                if (stopQuietly(timer)) {
                    stopped++;
                }
            }
        }
        timers.clear();
        tenantSnapshots.clear();
        states.clear();
        setupInProgress.clear();
        log.warn("Emergency stop: {} of {} timer(s) stopped, all tenant state cleared", stopped, total);
        return stopped;
    }

    /**
     * Starts every tenant with at least one enabled job. Runs at most once per process.
     *
     * @return number of tenants started
     */
    public int initializeFromStore() {
        if (!initialized.compareAndSet(false, true)) {
            log.debug("Polling already initialized, ignoring");
            return 0;
        }
        Set<String> tenantIds = new LinkedHashSet<>();
        try {
            tenantDirectory.findTenantsWithPollingEnabled().forEach(tenant -> tenantIds.add(tenant.getId()));
            tenantIds.addAll(new TreeSet<>(jobStore.findTenantsWithActiveJobs()));
        } catch (RuntimeException e) {
            log.error("Failed to enumerate tenants for polling initialization", e);
        }

        int started = 0;
        for (String tenantId : tenantIds) {
            if (startTenant(tenantId) == SetupOutcome.STARTED) {
                started++;
            }
        }
        log.info("Polling initialized: {} of {} tenant(s) started", started, tenantIds.size());
        return started;
    }

    @PreDestroy
    public void shutdown() {
        if (!timers.isEmpty()) {
            emergencyStopAll();
        }
    }

    // ---------------------------------------------------------------------
    // Tick
    // ---------------------------------------------------------------------

    void runTick(String tenantId, JobType jobType) {
        String executionId = executionLock.acquire(tenantId, jobType);
        if (executionId == null) {
            log.debug("Skipping {} tick for tenant {}: previous run still in progress", jobType.getKey(), tenantId);
            return;
        }
        try {
            Tenant tenant = tenantSnapshots.get(tenantId);
            if (tenant == null) {
                log.debug("Skipping {} tick for tenant {}: tenant no longer scheduled", jobType.getKey(), tenantId);
                return;
            }
            recordRunStart(tenantId, jobType);
            try {
                taskRegistry.taskFor(jobType).run(tenant);
                recordResult(tenantId, jobType, JobResult.SUCCESS, null);
            } catch (Exception e) {
                String message = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
                log.warn("{} poll failed for tenant {}: {}", jobType.getKey(), tenantId, message);
                recordResult(tenantId, jobType, JobResult.ERROR, message);
            }
        } finally {
            executionLock.release(tenantId, jobType, executionId);
        }
    }

    // ---------------------------------------------------------------------
    // Observability
    // ---------------------------------------------------------------------

    public TenantState tenantState(String tenantId) {
        MissingTenantException.require(tenantId, "polling state lookup");
        return states.getOrDefault(tenantId, TenantState.UNINITIALIZED);
    }

    public Optional<ActiveTimer> findTimer(String tenantId, JobType jobType) {
        MissingTenantException.require(tenantId, "timer lookup");
        Map<JobType, ActiveTimer> tenantTimers = timers.get(tenantId);
        return tenantTimers == null ? Optional.empty() : Optional.ofNullable(tenantTimers.get(jobType));
    }

    /** Running timers per tenant, ordered by tenant id. */
    public Map<String, Integer> activeTimerCounts() {
        Map<String, Integer> counts = new TreeMap<>();
        timers.forEach((tenantId, tenantTimers) -> {
            int running = (int) tenantTimers.values().stream().filter(ActiveTimer::isRunning).count();
            if (running > 0) {
                counts.put(tenantId, running);
            }
        });
        return counts;
    }

    public int totalActiveTimers() {
        return activeTimerCounts().values().stream().mapToInt(Integer::intValue).sum();
    }

    /** Every tenant the manager has seen since the last emergency stop. */
    public Set<String> knownTenants() {
        Set<String> tenants = new TreeSet<>(states.keySet());
        tenants.addAll(timers.keySet());
        return tenants;
    }

    /** Live timers of the tenant keyed by job type key, in job type order. */
    public Map<String, TimerStatus> timerStatuses(String tenantId) {
        MissingTenantException.require(tenantId, "timer lookup");
        Map<JobType, ActiveTimer> tenantTimers = new EnumMap<>(JobType.class);
        tenantTimers.putAll(timers.getOrDefault(tenantId, Collections.emptyMap()));
        Map<String, TimerStatus> timerStatuses = new LinkedHashMap<>();
        tenantTimers.forEach((jobType, timer) -> timerStatuses.put(jobType.getKey(), TimerStatus.of(timer)));
        return timerStatuses;
    }

    public TenantPollingStatus tenantStatus(String tenantId) {
        MissingTenantException.require(tenantId, "polling status");

        List<JobSpec> jobs;
        try {
            jobs = jobStore.getJobs(tenantId);
        } catch (RuntimeException e) {
            log.warn("Failed to read jobs of tenant {}: {}", tenantId, e.getMessage());
            jobs = List.of();
        }
        return TenantPollingStatus.builder()
                .tenantId(tenantId)
                .state(tenantState(tenantId))
                .setupInProgress(setupInProgress.contains(tenantId))
                .timers(timerStatuses(tenantId))
                .jobs(jobs)
                .build();
    }

    // ---------------------------------------------------------------------
    // Internals
    // ---------------------------------------------------------------------

    private boolean beginSetup(String tenantId, String operation) {
        if (!setupInProgress.add(tenantId)) {
            log.warn("Polling {} for tenant {} rejected: another setup is in progress", operation, tenantId);
            return false;
        }
        return true;
    }

    private TenantLookup lookupEligibleTenant(String tenantId) {
        Optional<Tenant> found;
        try {
            found = tenantDirectory.getTenantWithCredentials(tenantId);
        } catch (RuntimeException e) {
            log.error("Failed to load tenant {} for polling setup", tenantId, e);
            return TenantLookup.rejected(SetupOutcome.FAILED);
        }
        if (found.isEmpty()) {
            log.warn("Tenant {} not found, polling not configured", tenantId);
            return TenantLookup.rejected(SetupOutcome.TENANT_NOT_FOUND);
        }
        Tenant tenant = found.get();
        if (!tenant.isActive()) {
            log.warn("Tenant {} is inactive, polling not configured", tenantId);
            return TenantLookup.rejected(SetupOutcome.TENANT_INACTIVE);
        }
        if (!tenant.hasCompleteCredentials()) {
            log.warn("Tenant {} has incomplete Azure DevOps credentials, polling not configured", tenantId);
            return TenantLookup.rejected(SetupOutcome.MISSING_CREDENTIALS);
        }
        if (tenant.getPolling() == null) {
            tenant = tenant.toBuilder().polling(new PollingSettings()).build();
        }
        return new TenantLookup(tenant, null);
    }

    private SetupOutcome doStart(Tenant tenant) {
        String tenantId = tenant.getId();
        states.put(tenantId, TenantState.STARTING);
        destroyTimers(tenantId);
        tenantSnapshots.put(tenantId, tenant);
        try {
            for (JobType jobType : JobType.values()) {
                jobStore.createOrUpdateJob(tenantId, jobType, tenant.getPolling().jobConfig(jobType));
            }
            int scheduled = 0;
            for (JobSpec job : jobStore.getActiveJobs(tenantId)) {
                if (scheduleTimer(job)) {
                    scheduled++;
                }
            }
            states.put(tenantId, TenantState.RUNNING);
            log.info("Started polling for tenant {} with {} timer(s)", tenantId, scheduled);
            return SetupOutcome.STARTED;
        } catch (RuntimeException e) {
            log.error("Job store failure while starting polling for tenant {}", tenantId, e);
            destroyTimers(tenantId);
            tenantSnapshots.remove(tenantId);
            states.put(tenantId, TenantState.STOPPED);
            return SetupOutcome.FAILED;
        }
    }

    private SetupOutcome doUpdate(Tenant tenant) {
        String tenantId = tenant.getId();
        tenantSnapshots.put(tenantId, tenant);
        int replaced = 0;
        try {
            for (JobType jobType : JobType.values()) {
                JobConfig desired = tenant.getPolling().jobConfig(jobType);
                Optional<JobSpec> existing = jobStore.findJob(tenantId, jobType);
                boolean configUnchanged = existing.isPresent() && existing.get().toConfig().equals(desired);
                boolean shouldRun = desired.isEnabled() && ScheduleExpressions.isValid(desired.getScheduleExpression());
                boolean timerRunning = findTimer(tenantId, jobType).map(ActiveTimer::isRunning).orElse(false);
                if (configUnchanged && shouldRun == timerRunning) {
                    continue;
                }

                JobSpec job = jobStore.createOrUpdateJob(tenantId, jobType, desired);
                destroyTimer(tenantId, jobType);
                if (job.isSchedulable()) {
                    scheduleTimer(job);
                }
                replaced++;
            }
        } catch (RuntimeException e) {
            log.error("Job store failure while updating polling for tenant {}", tenantId, e);
            return SetupOutcome.FAILED;
        }
        log.info("Updated polling for tenant {}: {} job type(s) rescheduled", tenantId, replaced);
        return SetupOutcome.UPDATED;
    }

    private boolean scheduleTimer(JobSpec job) {
        String tenantId = job.getTenantId();
        JobType jobType = job.getJobType();
        String expression = job.getScheduleExpression();

        CronTrigger trigger;
        try {
            trigger = ScheduleExpressions.toTrigger(expression, zone);
        } catch (IllegalArgumentException e) {
            log.error("Invalid schedule '{}' for {} of tenant {}, job type not scheduled: {}",
                    expression, jobType.getKey(), tenantId, e.getMessage());
            return false;
        }

        ActiveTimer timer = new ActiveTimer(tenantId, jobType, expression, clock.instant(),
                () -> runTick(tenantId, jobType));
        try {
            timer.start(taskScheduler, trigger);
        } catch (RuntimeException e) {
            log.error("Failed to schedule {} for tenant {}", jobType.getKey(), tenantId, e);
            return false;
        }

        ActiveTimer previous = timers.computeIfAbsent(tenantId, id -> new ConcurrentHashMap<>()).put(jobType, timer);
        if (previous != null) {
            stopQuietly(previous);
        }
        log.info("Scheduled {} for tenant {} with '{}' (timer {})",
                jobType.getKey(), tenantId, expression, timer.getTimerId());
        return true;
    }

    private int destroyTimers(String tenantId) {
        Map<JobType, ActiveTimer> tenantTimers = timers.remove(tenantId);
        if (tenantTimers == null) {
            return 0;
        }
        tenantTimers.values().forEach(this::stopQuietly);
        return tenantTimers.size();
    }

    private void destroyTimer(String tenantId, JobType jobType) {
        Map<JobType, ActiveTimer> tenantTimers = timers.get(tenantId);
        if (tenantTimers == null) {
            return;
        }
        ActiveTimer timer = tenantTimers.remove(jobType);
        if (timer != null) {
            stopQuietly(timer);
            log.debug("Destroyed {} timer {} of tenant {}", jobType.getKey(), timer.getTimerId(), tenantId);
        }
    }

    private boolean stopQuietly(ActiveTimer timer) {
        try {
            timer.stop();
            return true;
        } catch (RuntimeException e) {
            log.warn("Failed to cancel {} timer {} of tenant {}: {}",
                    timer.getJobType().getKey(), timer.getTimerId(), timer.getTenantId(), e.getMessage());
            return false;
        }
    }

    private void recordRunStart(String tenantId, JobType jobType) {
        try {
            jobStore.updateLastRun(tenantId, jobType);
        } catch (RuntimeException e) {
            log.warn("Failed to record {} run start for tenant {}: {}", jobType.getKey(), tenantId, e.getMessage());
        }
    }

    private void recordResult(String tenantId, JobType jobType, JobResult result, String errorMessage) {
        try {
            jobStore.updateJobResult(tenantId, jobType, result, errorMessage);
        } catch (RuntimeException e) {
            log.warn("Failed to record {} result for tenant {}: {}", jobType.getKey(), tenantId, e.getMessage());
        }
    }

    @Value
    private static class TenantLookup {
        Tenant tenant;
        SetupOutcome rejection;

        static TenantLookup rejected(SetupOutcome rejection) {
            return new TenantLookup(null, rejection);
        }
    }
}
