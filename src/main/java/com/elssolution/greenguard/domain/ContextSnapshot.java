package com.elssolution.greenguard.domain;

import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;

/**
 * Environmental signals for one reading. Every field is populated; synthetic values
 * replace whatever a live source could not deliver.
 */
public record ContextSnapshot(
        double temperatureC,
        String weatherCondition,
        int humidityPct,
        double gridCarbonIntensity,
        SourceProvenance sourceProvenance,
        Instant observedAt,
        List<String> fallbackReasons
) {
    private static final double HIGH_INTENSITY_G_PER_KWH = 500.0;
    private static final Set<String> RAIN_CONDITIONS = Set.of("rain", "rainy", "drizzle", "thunderstorm");

    public ContextSnapshot {
        Objects.requireNonNull(weatherCondition, "weatherCondition");
        Objects.requireNonNull(sourceProvenance, "sourceProvenance");
        Objects.requireNonNull(observedAt, "observedAt");
        fallbackReasons = fallbackReasons == null ? List.of() : List.copyOf(fallbackReasons);
    }

    public boolean isRainy() {
        return RAIN_CONDITIONS.contains(weatherCondition.trim().toLowerCase(Locale.ROOT));
    }

    public boolean isHighIntensity() {
        return gridCarbonIntensity > HIGH_INTENSITY_G_PER_KWH;
    }

    public boolean isFullyLive() {
        return sourceProvenance.weather() == Provenance.API && sourceProvenance.grid() == Provenance.API;
    }
}
