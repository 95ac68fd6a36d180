package com.insightops.dashboard.devops;

import lombok.Value;

import java.time.Instant;
import java.util.List;

/**
 * Result of one work item query, cached per tenant and project.
 */
@Value
public class WorkItemSummary {

    String project;
    int count;
    List<Integer> workItemIds;
    Instant fetchedAt;
}
