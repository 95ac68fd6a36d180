package com.insightops.dashboard.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Centralised configuration properties for the InsightOps dashboard backend.
 *
 * <p>Every timing constant of the scheduling subsystem is exposed under the
 * {@code dashboard.*} prefix and can be overridden via {@code application.properties},
 * environment variables, or command-line arguments. For example:</p>
 * <pre>
 *   dashboard.lock-max-run-seconds=900
 *   DASHBOARD_DEDUPE_WINDOW_SECONDS=120
 * </pre>
 */
@Getter
@Setter
@Configuration
@ConfigurationProperties(prefix = "dashboard")
public class DashboardProperties {

    /** Number of threads shared by all tenant polling timers (default: 4). */
    private int schedulerPoolSize = 4;

    /** Time zone used to evaluate schedule expressions (default: UTC). */
    private String timeZone = "UTC";

    /** Start every tenant with polling enabled once the application is ready (default: true). */
    private boolean initializeOnStartup = true;

    /** Age after which an execution lock is considered stale and reclaimed (default: 600). */
    private long lockMaxRunSeconds = 600;

    /** Interval of the stale-lock sweep in seconds (default: 60). */
    private long lockSweepSeconds = 60;

    /** TTL applied by the tenant cache when the caller does not pass one (default: 60). */
    private long cacheDefaultTtlSeconds = 60;

    /** Interval of the expired-entry cache sweep in seconds (default: 60). */
    private long cacheSweepSeconds = 60;

    /** Window during which a repeated webhook event is treated as a duplicate (default: 60). */
    private long dedupeWindowSeconds = 60;

    /** Interval of the dedupe table sweep in seconds (default: 300). */
    private long dedupeSweepSeconds = 300;

    /** Timeout for a single upstream Azure DevOps call in seconds (default: 30). */
    private long upstreamTimeoutSeconds = 30;

    /** Interval of the WebSocket status push in seconds (default: 5). */
    private long statusPushSeconds = 5;

    /** Location of the tenant settings file, resolved against the working directory, then the classpath. */
    private String tenantsFile = "tenants.yaml";
}
