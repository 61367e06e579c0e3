package com.elssolution.greenguard.web;

import com.elssolution.greenguard.alerts.AlertService;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class StatusController {

    private final AlertService alerts;

    public StatusController(AlertService alerts) {
        this.alerts = alerts;
    }

    @GetMapping("/api/alerts")
    public AlertService.AlertsSnapshot getAlerts() {
        return alerts.snapshot();
    }
}
