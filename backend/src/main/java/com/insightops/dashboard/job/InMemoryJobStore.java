package com.insightops.dashboard.job;

import com.insightops.dashboard.tenant.MissingTenantException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Repository;

import java.time.Clock;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * Process-local {@link JobStore} keeping one immutable {@link JobSpec} per
 * (tenant, job type), partitioned by tenant at the top level.
 *
 * <p>Updates against a job that does not exist are logged and ignored, matching
 * the behaviour of the document store this adapter stands in for.</p>
 */
@Slf4j
@Repository
public class InMemoryJobStore implements JobStore {

    private final Map<String, Map<JobType, JobSpec>> jobsByTenant = new ConcurrentHashMap<>();

    private final Clock clock;

    public InMemoryJobStore(Clock clock) {
        this.clock = clock;
    }

    @Override
    public JobSpec createOrUpdateJob(String tenantId, JobType jobType, JobConfig config) {
        MissingTenantException.require(tenantId, "createOrUpdateJob");
        Instant now = clock.instant();
        return tenantJobs(tenantId).compute(jobType, (type, existing) -> {
            JobSpec.JobSpecBuilder builder = existing == null
                    ? JobSpec.builder().tenantId(tenantId).jobType(type)
                    : existing.toBuilder();
            return builder
                    .enabled(config.isEnabled())
                    .scheduleExpression(config.getScheduleExpression())
                    .status(JobStatus.ACTIVE)
                    .updatedAt(now)
                    .build();
        });
    }

    @Override
    public List<JobSpec> getActiveJobs(String tenantId) {
        return getJobs(tenantId).stream()
                .filter(JobSpec::isSchedulable)
                .toList();
    }

    @Override
    public List<JobSpec> getJobs(String tenantId) {
        MissingTenantException.require(tenantId, "getJobs");
        Map<JobType, JobSpec> jobs = jobsByTenant.get(tenantId);
        if (jobs == null) {
            return List.of();
        }
        return jobs.values().stream()
                .sorted(Comparator.comparing(JobSpec::getJobType))
                .toList();
    }

    @Override
    public Optional<JobSpec> findJob(String tenantId, JobType jobType) {
        MissingTenantException.require(tenantId, "findJob");
        Map<JobType, JobSpec> jobs = jobsByTenant.get(tenantId);
        return jobs == null ? Optional.empty() : Optional.ofNullable(jobs.get(jobType));
    }

    @Override
    public void pauseJobs(String tenantId) {
        MissingTenantException.require(tenantId, "pauseJobs");
        Map<JobType, JobSpec> jobs = jobsByTenant.get(tenantId);
        if (jobs == null) {
            return;
        }
        Instant now = clock.instant();
        jobs.replaceAll((type, job) -> job.toBuilder()
                .status(JobStatus.PAUSED)
                .updatedAt(now)
                .build());
        log.debug("Paused {} job(s) for tenant {}", jobs.size(), tenantId);
    }

    @Override
    public void updateLastRun(String tenantId, JobType jobType) {
        MissingTenantException.require(tenantId, "updateLastRun");
        Instant now = clock.instant();
        JobSpec updated = tenantJobs(tenantId).computeIfPresent(jobType, (type, job) -> job.toBuilder()
                .lastRun(now)
                .updatedAt(now)
                .build());
        if (updated == null) {
            log.warn("No {} job stored for tenant {}; last run not recorded", jobType.getKey(), tenantId);
        }
    }

    @Override
    public void updateJobResult(String tenantId, JobType jobType, JobResult result, String errorMessage) {
        MissingTenantException.require(tenantId, "updateJobResult");
        Instant now = clock.instant();
        JobSpec updated = tenantJobs(tenantId).computeIfPresent(jobType, (type, job) -> {
            JobSpec.JobSpecBuilder builder = job.toBuilder()
                    .lastResult(result)
                    .updatedAt(now);
            // a run finishing after pauseJobs must not resume the job
            boolean paused = job.getStatus() == JobStatus.PAUSED;
            if (errorMessage != null) {
                builder.lastError(errorMessage);
                if (!paused) {
                    builder.status(JobStatus.ERROR);
                }
            } else if (result == JobResult.SUCCESS) {
                builder.lastError(null);
                if (!paused) {
                    builder.status(JobStatus.ACTIVE);
                }
            }
            return builder.build();
        });
        if (updated == null) {
            log.warn("No {} job stored for tenant {}; result {} not recorded", jobType.getKey(), tenantId, result);
        }
    }

    @Override
    public Set<String> findTenantsWithActiveJobs() {
        return jobsByTenant.entrySet().stream()
                .filter(entry -> entry.getValue().values().stream().anyMatch(JobSpec::isSchedulable))
                .map(Map.Entry::getKey)
                .collect(Collectors.toUnmodifiableSet());
    }

    private Map<JobType, JobSpec> tenantJobs(String tenantId) {
        return jobsByTenant.computeIfAbsent(tenantId, id -> new ConcurrentHashMap<>());
    }
}
