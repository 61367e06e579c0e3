package com.elssolution.greenguard.service;

import com.elssolution.greenguard.domain.ClassifierVerdict;
import com.elssolution.greenguard.domain.FacilityRules;
import com.elssolution.greenguard.domain.Maths;
import com.elssolution.greenguard.domain.Severity;
import com.elssolution.greenguard.domain.TelemetryRecord;
import com.elssolution.greenguard.domain.VerdictSource;
import org.springframework.stereotype.Component;

import java.util.Locale;

/**
 * Deterministic check of a reading against the facility's contracted ceiling.
 * Variance is signed: negative means under the ceiling.
 */
@Component
public class RuleClassifier {

    public static final double ANOMALY_THRESHOLD_PCT = 20.0;
    public static final double WARNING_THRESHOLD_PCT = 10.0;

    static final int ANOMALY_CONFIDENCE  = 85;
    static final int WARNING_CONFIDENCE  = 70;
    static final int VERIFIED_CONFIDENCE = 80;

    public ClassifierVerdict classify(TelemetryRecord reading, FacilityRules rules) {
        double max = rules.requireValid().getMaxLoadKwh();
        double energy = reading.energyKwh();
        double variancePct = variancePct(energy, max);
        String variance = Maths.pct1(variancePct);

        if (variancePct > ANOMALY_THRESHOLD_PCT) {
            return verdict(Severity.ANOMALY, ANOMALY_CONFIDENCE, String.format(Locale.ROOT,
                    "Energy %.1f kWh exceeds max load %.1f kWh by %s%% (> %.0f%% anomaly threshold)",
                    energy, max, variance, ANOMALY_THRESHOLD_PCT));
        }
        if (variancePct > WARNING_THRESHOLD_PCT) {
            return verdict(Severity.WARNING, WARNING_CONFIDENCE, String.format(Locale.ROOT,
                    "Energy %.1f kWh exceeds max load %.1f kWh by %s%% (> %.0f%% warning threshold, <= %.0f%% anomaly threshold)",
                    energy, max, variance, WARNING_THRESHOLD_PCT, ANOMALY_THRESHOLD_PCT));
        }
        return verdict(Severity.VERIFIED, VERIFIED_CONFIDENCE, String.format(Locale.ROOT,
                "Energy %.1f kWh within limits: variance %s%% vs max load %.1f kWh (warning above %.0f%%, anomaly above %.0f%%)",
                energy, variance, max, WARNING_THRESHOLD_PCT, ANOMALY_THRESHOLD_PCT));
    }

    /** (energy - max) / max as a percentage. Callers guarantee max > 0. */
    public static double variancePct(double energyKwh, double maxLoadKwh) {
        return (energyKwh - maxLoadKwh) * 100.0 / maxLoadKwh;
    }

    private static ClassifierVerdict verdict(Severity s, int confidence, String reasoning) {
        return new ClassifierVerdict(s, confidence, reasoning, VerdictSource.RULE_ENGINE);
    }
}
