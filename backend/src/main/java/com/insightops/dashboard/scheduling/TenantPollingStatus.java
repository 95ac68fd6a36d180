package com.insightops.dashboard.scheduling;

import com.insightops.dashboard.job.JobSpec;
import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * Polling state of one tenant: lifecycle state, live timers keyed by job type key,
 * and the stored job bookkeeping.
 */
@Value
@Builder
public class TenantPollingStatus {

    String tenantId;
    TenantState state;
    boolean setupInProgress;
    Map<String, TimerStatus> timers;
    List<JobSpec> jobs;
}
