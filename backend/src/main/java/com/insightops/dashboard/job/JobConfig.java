package com.insightops.dashboard.job;

import lombok.Value;

/**
 * The schedulable part of a job: whether it runs and on which schedule.
 */
@Value
public class JobConfig {

    boolean enabled;

    String scheduleExpression;
}
