package com.elssolution.greenguard.service;

import com.elssolution.greenguard.domain.ContextSnapshot;
import com.elssolution.greenguard.domain.ContextualAnalysis;
import com.elssolution.greenguard.domain.FacilityRules;
import com.elssolution.greenguard.domain.Maths;
import com.elssolution.greenguard.domain.TelemetryRecord;
import org.springframework.stereotype.Component;

import java.util.Locale;

@Component
public class AiPromptBuilder {

    public String build(ClassificationInput in) {
        TelemetryRecord r = in.reading();
        ContextSnapshot c = in.context();
        FacilityRules rules = in.rules();
        double loadPct = r.energyKwh() / rules.getMaxLoadKwh() * 100.0;

        StringBuilder sb = new StringBuilder(1024);
        sb.append("You are an energy audit assistant for an industrial green-finance programme.\n")
          .append("Classify one smart-meter reading as VERIFIED, WARNING or ANOMALY.\n\n");

        sb.append("READING\n")
          .append(line("facility", rules.getName() + " (" + rules.getFacilityId() + ")"))
          .append(line("timestamp", r.timestamp().toString()))
          .append(line("energy_kwh", fmt(r.energyKwh())))
          .append(line("voltage_v", fmt(r.voltage())))
          .append(line("current_a", fmt(r.currentAmps())))
          .append(line("power_w", fmt(r.powerWatts())))
          .append('\n');

        sb.append("CONTEXT\n")
          .append(line("temperature_c", fmt(c.temperatureC()) + " [" + c.sourceProvenance().weather().label() + "]"))
          .append(line("weather", c.weatherCondition()))
          .append(line("humidity_pct", String.valueOf(c.humidityPct())))
          .append(line("grid_carbon_g_per_kwh", fmt(c.gridCarbonIntensity()) + " [" + c.sourceProvenance().grid().label() + "]"))
          .append('\n');

        sb.append("RULES\n")
          .append(line("max_load_kwh", fmt(rules.getMaxLoadKwh())))
          .append(line("baseline_carbon_g_per_kwh", fmt(rules.getBaselineCarbonIntensity())))
          .append(line("load_pct_of_max", Maths.pct1(loadPct)));
        if (in.historicalAverageKwh() != null) {
            sb.append(line("historical_avg_kwh", fmt(in.historicalAverageKwh())));
        }
        sb.append('\n');

        ContextualAnalysis a = in.analysis();
        if (a != null) {
            sb.append("CONTEXTUAL FLAGS\n")
              .append(line("suspicious", String.valueOf(a.suspicious())))
              .append(line("flags", a.flags().isEmpty() ? "none" : String.join(", ", a.flags())))
              .append(line("note", a.reasoning()))
              .append('\n');
        }

        sb.append("Guidance: usage above 120% of max load is an ANOMALY; above 100% is at least a WARNING; ")
          .append("heat can explain high cooling load, cool or rainy weather cannot.\n")
          .append("Reply with JSON only, no prose:\n")
          .append("{\"severity\": \"VERIFIED|WARNING|ANOMALY\", \"confidence\": 0-100, \"reasoning\": \"one or two sentences\"}");
        return sb.toString();
    }

    private static String line(String key, String value) {
        return "- " + key + ": " + value + "\n";
    }

    private static String fmt(double v) {
        return String.format(Locale.ROOT, "%.2f", v);
    }
}
