package com.insightops.dashboard.job;

/** Outcome of the most recent run of a job. */
public enum JobResult {
    PENDING,
    SUCCESS,
    ERROR
}
