package com.insightops.dashboard.status;

import com.insightops.dashboard.scheduling.TenantState;
import com.insightops.dashboard.scheduling.TimerStatus;
import lombok.Value;

import java.util.Map;

@Value
public class TenantSummary {

    TenantState state;

    /** Keyed by job type key, e.g. "pullRequests" */
    Map<String, TimerStatus> timers;
}
