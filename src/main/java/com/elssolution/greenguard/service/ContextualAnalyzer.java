package com.elssolution.greenguard.service;

import com.elssolution.greenguard.domain.ContextSnapshot;
import com.elssolution.greenguard.domain.ContextualAnalysis;
import com.elssolution.greenguard.domain.FacilityRules;
import com.elssolution.greenguard.domain.TelemetryRecord;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Cross-checks consumption against weather and grid state. Informational only: the result
 * goes into the trace and the AI prompt, severity is never derived from it.
 */
@Component
public class ContextualAnalyzer {

    public static final String HIGH_ENERGY_COOL_WEATHER = "HIGH_ENERGY_COOL_WEATHER";
    public static final String HIGH_CARBON_IMPACT       = "HIGH_CARBON_IMPACT";
    public static final String CRITICAL_OVERAGE         = "CRITICAL_OVERAGE";
    public static final String EXTREME_HEAT_HIGH_LOAD   = "EXTREME_HEAT_HIGH_LOAD";
    public static final String HIGH_LOAD_RAINY_DAY      = "HIGH_LOAD_RAINY_DAY";

    static final String DEFAULT_REASONING = "Energy usage aligns with environmental context";

    static final double COOL_TEMP_C = 22.0;
    static final double HOT_TEMP_C  = 35.0;
    static final double DIRTY_GRID_G_PER_KWH = 800.0;

    public ContextualAnalysis analyze(TelemetryRecord reading, ContextSnapshot ctx, FacilityRules rules) {
        double max = rules.requireValid().getMaxLoadKwh();
        double energy = reading.energyKwh();
        double loadRatio = energy / max;
        double temp = ctx.temperatureC();

        List<String> flags = new ArrayList<>();
        boolean suspicious = false;
        boolean explained = false;
        String reasoning = DEFAULT_REASONING;

        if (loadRatio >= 0.8 && temp < COOL_TEMP_C) {
            suspicious = true;
            flags.add(HIGH_ENERGY_COOL_WEATHER);
            reasoning = String.format(Locale.ROOT,
                    "High energy usage (%.1f kWh, %.0f%% of max) during cool weather (%.1f°C) is unusual",
                    energy, loadRatio * 100, temp);
        }

        if (ctx.gridCarbonIntensity() > DIRTY_GRID_G_PER_KWH && loadRatio >= 0.9) {
            flags.add(HIGH_CARBON_IMPACT);
            if (!suspicious) {
                reasoning = String.format(Locale.ROOT,
                        "High load on a carbon-intensive grid (%.0f g/kWh) increases emissions impact",
                        ctx.gridCarbonIntensity());
            }
        }

        if (loadRatio > 1.2) {
            suspicious = true;
            flags.add(CRITICAL_OVERAGE);
            reasoning = String.format(Locale.ROOT,
                    "Critical overage: %.1f kWh is %.0f%% of contracted max load %.1f kWh",
                    energy, loadRatio * 100, max);
        }

        if (temp > HOT_TEMP_C && loadRatio >= 0.85) {
            explained = true;
            flags.add(EXTREME_HEAT_HIGH_LOAD);
            if (!suspicious) {
                reasoning = String.format(Locale.ROOT,
                        "High load expected due to extreme heat (%.1f°C) driving cooling demand", temp);
            }
        }

        if (ctx.isRainy() && loadRatio >= 0.9) {
            flags.add(HIGH_LOAD_RAINY_DAY);
            if (!suspicious && !explained) {
                suspicious = true;
                reasoning = String.format(Locale.ROOT,
                        "Near-peak load (%.0f%% of max) on a rainy day with no cooling demand", loadRatio * 100);
            }
        }

        return new ContextualAnalysis(suspicious, reasoning, flags);
    }
}
