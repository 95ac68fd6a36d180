package com.insightops.dashboard.devops;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

@Value
@Builder
public class IdlePullRequest {

    int id;
    String title;
    String repository;
    String sourceBranch;
    String targetBranch;
    String createdBy;
    Instant createdDate;
    long idleDays;
    String url;
}
