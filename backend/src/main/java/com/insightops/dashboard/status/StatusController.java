package com.insightops.dashboard.status;

import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/status")
@RequiredArgsConstructor
public class StatusController {

    private final PollingStatusService pollingStatusService;

    @GetMapping
    public StatusSnapshot status() {
        return pollingStatusService.snapshot();
    }
}
