package com.smartmoneyradar.api.controller;

import com.smartmoneyradar.alert.engine.AlertEngine;
import com.smartmoneyradar.api.dto.HealthResponse;
import com.smartmoneyradar.ingestion.config.PollingProperties;
import com.smartmoneyradar.ingestion.filter.TrackedWallets;
import com.smartmoneyradar.ingestion.pipeline.MonitorStats;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * GET /health for the hosting platform's liveness check.
 */
@RestController
@RequiredArgsConstructor
public class HealthController {

    private final TrackedWallets trackedWallets;
    private final MonitorStats monitorStats;
    private final AlertEngine alertEngine;
    private final PollingProperties pollingProperties;

    @GetMapping("/health")
    public HealthResponse health() {
        return new HealthResponse("ok", trackedWallets.size(),
                monitorStats.snapshot(alertEngine.fakeAlertsBlocked()),
                pollingProperties.isEnabled() ? "webhook+polling" : "webhook");
    }
}
