package com.insightops.dashboard.job;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Persisted configuration and last-run bookkeeping for one (tenant, job type) pair.
 * Instances are immutable; stores replace them wholesale on every change.
 */
@Value
@Builder(toBuilder = true)
public class JobSpec {

    String tenantId;

    JobType jobType;

    boolean enabled;

    /** Cron expression, 5 fields (minute precision) or 6 fields (seconds first). */
    String scheduleExpression;

    @Builder.Default
    JobStatus status = JobStatus.ACTIVE;

    Instant lastRun;

    @Builder.Default
    JobResult lastResult = JobResult.PENDING;

    String lastError;

    Instant updatedAt;

    public JobConfig toConfig() {
        return new JobConfig(enabled, scheduleExpression);
    }

    /** Whether the job should currently have a live timer. */
    public boolean isSchedulable() {
        return enabled && status == JobStatus.ACTIVE;
    }
}
