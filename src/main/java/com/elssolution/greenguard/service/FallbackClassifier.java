package com.elssolution.greenguard.service;

import com.elssolution.greenguard.domain.ClassifierVerdict;
import com.elssolution.greenguard.domain.ContextSnapshot;
import com.elssolution.greenguard.domain.ContextualAnalysis;
import com.elssolution.greenguard.domain.FacilityRules;
import com.elssolution.greenguard.domain.Severity;
import com.elssolution.greenguard.domain.TelemetryRecord;
import com.elssolution.greenguard.domain.VerdictSource;
import org.springframework.stereotype.Component;

import java.util.Locale;

/** Local heuristic used whenever the AI provider can't give a usable answer. */
@Component
public class FallbackClassifier {

    static final double MILD_LOW_C  = 5.0;
    static final double MILD_HIGH_C = 32.0;

    public ClassifierVerdict classify(TelemetryRecord reading, ContextSnapshot ctx,
                                      FacilityRules rules, ContextualAnalysis analysis) {
        double max = rules.requireValid().getMaxLoadKwh();
        double energy = reading.energyKwh();
        double temp = ctx.temperatureC();

        Severity severity;
        int confidence;
        String reasoning;
        if (energy > max * 1.2) {
            severity = Severity.ANOMALY;
            confidence = 85;
            reasoning = String.format(Locale.ROOT,
                    "Energy %.1f kWh is more than 20%% above max load %.1f kWh", energy, max);
        } else if (energy > max && temp >= MILD_LOW_C && temp <= MILD_HIGH_C) {
            severity = Severity.ANOMALY;
            confidence = 75;
            reasoning = String.format(Locale.ROOT,
                    "Energy %.1f kWh exceeds max load %.1f kWh in mild weather (%.1f°C)", energy, max, temp);
        } else if (energy > max) {
            severity = Severity.WARNING;
            confidence = 60;
            reasoning = String.format(Locale.ROOT,
                    "Energy %.1f kWh exceeds max load %.1f kWh, partly explained by temperature (%.1f°C)",
                    energy, max, temp);
        } else if (energy >= max * 0.9) {
            severity = Severity.WARNING;
            confidence = 70;
            reasoning = String.format(Locale.ROOT,
                    "Energy %.1f kWh is within 10%% of max load %.1f kWh", energy, max);
        } else {
            severity = Severity.VERIFIED;
            confidence = 80;
            reasoning = String.format(Locale.ROOT,
                    "Energy %.1f kWh is within normal range of max load %.1f kWh", energy, max);
        }

        if (analysis != null && !analysis.reasoning().isBlank()) {
            reasoning = reasoning + ". Context: " + analysis.reasoning();
        }
        return new ClassifierVerdict(severity, confidence, reasoning, VerdictSource.AI_FALLBACK);
    }
}
