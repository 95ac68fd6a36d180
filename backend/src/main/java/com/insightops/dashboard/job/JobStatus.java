package com.insightops.dashboard.job;

/** Lifecycle status of a stored job document. */
public enum JobStatus {
    ACTIVE,
    PAUSED,
    ERROR
}
