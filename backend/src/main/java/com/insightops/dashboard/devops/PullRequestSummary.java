package com.insightops.dashboard.devops;

import lombok.Value;

import java.time.Instant;
import java.util.List;

/**
 * Active pull requests of a project and the subset considered idle.
 */
@Value
public class PullRequestSummary {

    String project;
    int activeCount;
    List<IdlePullRequest> idle;
    Instant fetchedAt;
}
