package com.insightops.dashboard.scheduling;

import com.insightops.dashboard.config.DashboardProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * Starts polling for every configured tenant once the application is ready.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SchedulingInitializer {

    private final SchedulingManager schedulingManager;
    private final DashboardProperties properties;

    @EventListener(ApplicationReadyEvent.class)
    public void onApplicationReady() {
        if (!properties.isInitializeOnStartup()) {
            log.info("Polling initialization on startup disabled (dashboard.initialize-on-startup=false)");
            return;
        }
        schedulingManager.initializeFromStore();
    }
}
