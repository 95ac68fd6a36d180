package com.insightops.dashboard.status;

import com.insightops.dashboard.scheduling.SchedulingManager;
import com.insightops.dashboard.scheduling.SetupOutcome;
import com.insightops.dashboard.scheduling.TenantPollingStatus;
import com.insightops.dashboard.tenant.PollingSettings;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Manual control over tenant polling. Setup outcomes are reported in the body,
 * never as HTTP errors.
 */
@RestController
@RequestMapping("/api/polling")
@RequiredArgsConstructor
public class PollingController {

    private final SchedulingManager schedulingManager;

    @PostMapping("/tenants/{tenantId}/start")
    public Map<String, Object> start(@PathVariable String tenantId) {
        return outcome(tenantId, schedulingManager.startTenant(tenantId));
    }

    @PostMapping("/tenants/{tenantId}/stop")
    public Map<String, Object> stop(@PathVariable String tenantId) {
        return outcome(tenantId, schedulingManager.stopTenant(tenantId));
    }

    @PutMapping("/tenants/{tenantId}")
    public Map<String, Object> update(@PathVariable String tenantId, @RequestBody PollingSettings patch) {
        return outcome(tenantId, schedulingManager.updateTenant(tenantId, patch));
    }

    @GetMapping("/tenants/{tenantId}")
    public TenantPollingStatus status(@PathVariable String tenantId) {
        return schedulingManager.tenantStatus(tenantId);
    }

    @PostMapping("/emergency-stop")
    public Map<String, Object> emergencyStop() {
        int stopped = schedulingManager.emergencyStopAll();
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("message", "All polling timers stopped");
        body.put("stoppedTimers", stopped);
        return body;
    }

    private static Map<String, Object> outcome(String tenantId, SetupOutcome outcome) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("tenantId", tenantId);
        body.put("outcome", outcome);
        body.put("applied", outcome.isApplied());
        return body;
    }
}
