package com.insightops.dashboard.tenant;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.insightops.dashboard.job.JobConfig;
import com.insightops.dashboard.job.JobType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Arrays;

/**
 * A tenant's polling settings as stored with the tenant record.
 *
 * <p>Every field is nullable so the same type also serves as a partial update:
 * {@link #mergedWith(PollingSettings)} overrides only the fields the patch sets.
 * Unset fields fall back to the defaults below when read through the accessors
 * that resolve them.</p>
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class PollingSettings {

    public static final String DEFAULT_WORK_ITEMS_INTERVAL = "*/10 * * * *";
    public static final String DEFAULT_PULL_REQUEST_INTERVAL = "0 */10 * * *";
    public static final String DEFAULT_OVERDUE_CHECK_INTERVAL = "0 */10 * * *";
    public static final int DEFAULT_IDLE_PR_MAX_DAYS = 90;
    public static final int DEFAULT_OVERDUE_MAX_DAYS = 60;

    private Boolean workItemsEnabled;
    private String workItemsInterval;

    private Boolean pullRequestEnabled;
    private String pullRequestInterval;

    private Boolean overdueCheckEnabled;
    private String overdueCheckInterval;

    /** Ignore idle pull requests older than {@link #idlePrMaxDays} */
    private Boolean idlePrFilterEnabled;
    private Integer idlePrMaxDays;

    /** Ignore overdue work items past due for more than {@link #overdueMaxDays} */
    private Boolean overdueFilterEnabled;
    private Integer overdueMaxDays;

    /**
     * Resolves the schedulable configuration of one job type, applying defaults.
     */
    public JobConfig jobConfig(JobType jobType) {
        return switch (jobType) {
            case WORK_ITEMS -> new JobConfig(
                    Boolean.TRUE.equals(workItemsEnabled),
                    orDefault(workItemsInterval, DEFAULT_WORK_ITEMS_INTERVAL));
            case PULL_REQUESTS -> new JobConfig(
                    Boolean.TRUE.equals(pullRequestEnabled),
                    orDefault(pullRequestInterval, DEFAULT_PULL_REQUEST_INTERVAL));
            case OVERDUE -> new JobConfig(
                    Boolean.TRUE.equals(overdueCheckEnabled),
                    orDefault(overdueCheckInterval, DEFAULT_OVERDUE_CHECK_INTERVAL));
        };
    }

    /** Whether at least one job type is enabled. */
    @JsonIgnore
    public boolean isAnyJobEnabled() {
        return Arrays.stream(JobType.values()).anyMatch(type -> jobConfig(type).isEnabled());
    }

    @JsonIgnore
    public boolean isIdlePrFilterActive() {
        return Boolean.TRUE.equals(idlePrFilterEnabled) && resolvedIdlePrMaxDays() > 0;
    }

    public int resolvedIdlePrMaxDays() {
        return idlePrMaxDays != null ? idlePrMaxDays : DEFAULT_IDLE_PR_MAX_DAYS;
    }

    @JsonIgnore
    public boolean isOverdueFilterActive() {
        return !Boolean.FALSE.equals(overdueFilterEnabled) && resolvedOverdueMaxDays() > 0;
    }

    public int resolvedOverdueMaxDays() {
        return overdueMaxDays != null ? overdueMaxDays : DEFAULT_OVERDUE_MAX_DAYS;
    }

    /**
     * Returns a new settings object where every field set on {@code patch}
     * replaces the corresponding field of this one.
     */
    public PollingSettings mergedWith(PollingSettings patch) {
        if (patch == null) {
            return toBuilder().build();
        }
        return PollingSettings.builder()
                .workItemsEnabled(pick(patch.workItemsEnabled, workItemsEnabled))
                .workItemsInterval(pick(patch.workItemsInterval, workItemsInterval))
                .pullRequestEnabled(pick(patch.pullRequestEnabled, pullRequestEnabled))
                .pullRequestInterval(pick(patch.pullRequestInterval, pullRequestInterval))
                .overdueCheckEnabled(pick(patch.overdueCheckEnabled, overdueCheckEnabled))
                .overdueCheckInterval(pick(patch.overdueCheckInterval, overdueCheckInterval))
                .idlePrFilterEnabled(pick(patch.idlePrFilterEnabled, idlePrFilterEnabled))
                .idlePrMaxDays(pick(patch.idlePrMaxDays, idlePrMaxDays))
                .overdueFilterEnabled(pick(patch.overdueFilterEnabled, overdueFilterEnabled))
                .overdueMaxDays(pick(patch.overdueMaxDays, overdueMaxDays))
                .build();
    }

    private static <T> T pick(T preferred, T fallback) {
        return preferred != null ? preferred : fallback;
    }

    private static String orDefault(String value, String fallback) {
        return value == null || value.isBlank() ? fallback : value.trim();
    }
}
