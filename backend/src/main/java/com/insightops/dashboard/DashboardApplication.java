package com.insightops.dashboard;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Main entry point for the InsightOps dashboard backend.
 * Polls each tenant's Azure DevOps organization on per-tenant schedules,
 * ingests service hook webhooks and serves the polling status over REST
 * and WebSocket.
 */
@SpringBootApplication
public class DashboardApplication {

    public static void main(String[] args) {
        SpringApplication.run(DashboardApplication.class, args);
    }
}
