package com.elssolution.greenguard.service;

import com.elssolution.greenguard.domain.ContextSnapshot;
import com.elssolution.greenguard.domain.ContextualAnalysis;
import com.elssolution.greenguard.domain.FacilityRules;
import com.elssolution.greenguard.domain.TelemetryRecord;

import java.util.Objects;

/** Everything the AI stage may look at. {@code analysis} and {@code historicalAverageKwh} are optional. */
public record ClassificationInput(
        TelemetryRecord reading,
        ContextSnapshot context,
        FacilityRules rules,
        ContextualAnalysis analysis,
        Double historicalAverageKwh
) {
    public ClassificationInput {
        Objects.requireNonNull(reading, "reading");
        Objects.requireNonNull(context, "context");
        Objects.requireNonNull(rules, "rules");
    }

    public static ClassificationInput of(TelemetryRecord reading, ContextSnapshot context, FacilityRules rules) {
        return new ClassificationInput(reading, context, rules, null, null);
    }
}
