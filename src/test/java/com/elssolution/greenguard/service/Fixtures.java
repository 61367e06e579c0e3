package com.elssolution.greenguard.service;

import com.elssolution.greenguard.domain.*;

import java.time.Instant;
import java.util.List;
import java.util.Map;

final class Fixtures {

    static final Instant NOON = Instant.parse("2025-03-14T12:00:00Z");

    private Fixtures() {}

    static FacilityRules ahmedabad() {
        return FacilityRules.builder()
                .facilityId("ahmedabad-textiles")
                .name("Ahmedabad Textiles Ltd")
                .maxLoadKwh(350)
                .baselineCarbonIntensity(820)
                .location(new GeoLocation("Ahmedabad", 23.0225, 72.5714))
                .build();
    }

    static TelemetryRecord reading(double energyKwh) {
        return new TelemetryRecord("t-1", "ahmedabad-textiles", NOON, energyKwh, 230, 12.5, 2875, Map.of());
    }

    static ContextSnapshot context(double tempC, String condition, double gridIntensity) {
        return new ContextSnapshot(tempC, condition, 60, gridIntensity,
                new SourceProvenance(Provenance.API, Provenance.API), NOON, List.of());
    }
}
