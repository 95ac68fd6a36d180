package com.insightops.dashboard.job;

import java.util.Arrays;
import java.util.Optional;

/**
 * The recurring jobs every tenant can run. The key is the name used in stored
 * job documents and in the status surface.
 */
public enum JobType {

    WORK_ITEMS("workItems"),
    PULL_REQUESTS("pullRequests"),
    OVERDUE("overdue");

    private final String key;

    JobType(String key) {
        this.key = key;
    }

    public String getKey() {
        return key;
    }

    public static Optional<JobType> fromKey(String key) {
        return Arrays.stream(values())
                .filter(type -> type.key.equalsIgnoreCase(key))
                .findFirst();
    }
}
