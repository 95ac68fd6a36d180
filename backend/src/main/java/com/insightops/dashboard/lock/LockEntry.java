package com.insightops.dashboard.lock;

import com.insightops.dashboard.job.JobType;
import lombok.Value;

import java.time.Instant;

/**
 * A held execution lock for one (tenant, job type).
 */
@Value
public class LockEntry {

    String tenantId;

    JobType jobType;

    String executionId;

    Instant acquiredAt;
}
