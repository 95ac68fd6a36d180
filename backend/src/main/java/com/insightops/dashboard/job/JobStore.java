package com.insightops.dashboard.job;

import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Durable configuration and last-run bookkeeping for every (tenant, job type) pair.
 *
 * <p>Every method takes the tenant id as its first argument and implementations
 * must reject a missing one rather than operate on unscoped data.</p>
 */
public interface JobStore {

    /**
     * Creates the job if absent, otherwise replaces its schedulable configuration.
     * Either way the job ends up {@link JobStatus#ACTIVE}.
     */
    JobSpec createOrUpdateJob(String tenantId, JobType jobType, JobConfig config);

    /** Jobs of the tenant that are both enabled and {@link JobStatus#ACTIVE}. */
    List<JobSpec> getActiveJobs(String tenantId);

    /** All jobs of the tenant regardless of status. */
    List<JobSpec> getJobs(String tenantId);

    Optional<JobSpec> findJob(String tenantId, JobType jobType);

    /** Marks every job of the tenant {@link JobStatus#PAUSED}. */
    void pauseJobs(String tenantId);

    /** Records that a run of the job has just started. */
    void updateLastRun(String tenantId, JobType jobType);

    /**
     * Records the outcome of a run. An error message moves the job to
     * {@link JobStatus#ERROR}; a success clears the previous error. A
     * {@link JobStatus#PAUSED} job keeps its status either way.
     */
    void updateJobResult(String tenantId, JobType jobType, JobResult result, String errorMessage);

    /** Tenants owning at least one enabled, active job. */
    Set<String> findTenantsWithActiveJobs();
}
