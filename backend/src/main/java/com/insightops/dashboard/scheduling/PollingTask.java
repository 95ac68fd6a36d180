package com.insightops.dashboard.scheduling;

import com.insightops.dashboard.job.JobType;
import com.insightops.dashboard.tenant.Tenant;

/**
 * Tenant-scoped work performed on every tick of one job type.
 *
 * <p>Implementations are free to block on upstream I/O. Anything they throw is
 * recorded as the job's last error; the timer keeps firing.</p>
 */
public interface PollingTask {

    /** The job type this task serves. Exactly one task per type must exist. */
    JobType jobType();

    void run(Tenant tenant) throws Exception;
}
