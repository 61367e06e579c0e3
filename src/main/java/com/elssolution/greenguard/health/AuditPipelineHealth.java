package com.elssolution.greenguard.health;

import com.elssolution.greenguard.alerts.AlertService;
import com.elssolution.greenguard.domain.Severity;
import com.elssolution.greenguard.integration.GridIntensityProvider;
import com.elssolution.greenguard.integration.TextCompletionProvider;
import com.elssolution.greenguard.integration.WeatherProvider;
import com.elssolution.greenguard.service.AuditReviewService;
import org.springframework.boot.actuate.health.*;
import org.springframework.stereotype.Component;

/** DOWN only while audits are failing; provider outages degrade to synthetic data and stay UP. */
@Component
public class AuditPipelineHealth implements HealthIndicator {
    private final AlertService alerts;
    private final AuditReviewService reviews;
    private final WeatherProvider weather;
    private final GridIntensityProvider grid;
    private final TextCompletionProvider ai;

    public AuditPipelineHealth(AlertService alerts, AuditReviewService reviews,
                               WeatherProvider weather, GridIntensityProvider grid, TextCompletionProvider ai) {
        this.alerts = alerts;
        this.reviews = reviews;
        this.weather = weather;
        this.grid = grid;
        this.ai = ai;
    }

    @Override public Health health() {
        boolean ok = !alerts.isActive(AlertService.PIPELINE_FAILURE);
        var pending = reviews.pendingCountBySeverity();
        var activeKeys = alerts.snapshot().getActive().stream().map(AlertService.AlertView::getKey).toList();

        return (ok ? Health.up() : Health.down())
                .withDetail("weather", weather.isConfigured() ? "api" : "synthetic")
                .withDetail("grid", grid.isConfigured() ? "api" : "synthetic")
                .withDetail("ai", ai.isConfigured() ? "api" : "fallback")
                .withDetail("activeAlerts", activeKeys)
                .withDetail("pendingAnomalies", pending.getOrDefault(Severity.ANOMALY, 0L))
                .withDetail("pendingWarnings", pending.getOrDefault(Severity.WARNING, 0L))
                .build();
    }
}
