package com.elssolution.greenguard.domain;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * One sensor reading as stored by the ingestion boundary. Read-only to the audit pipeline.
 */
public record TelemetryRecord(
        String id,
        String facilityId,
        Instant timestamp,
        double energyKwh,
        double voltage,
        double currentAmps,
        double powerWatts,
        Map<String, Object> rawPayload
) {
    public TelemetryRecord {
        Objects.requireNonNull(facilityId, "facilityId");
        Objects.requireNonNull(timestamp, "timestamp");
        if (!(energyKwh >= 0)) {
            throw new TelemetryValidationException("energyKwh must be >= 0, got " + energyKwh);
        }
        // JSON payloads may carry null values, which Map.copyOf rejects
        rawPayload = rawPayload == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(rawPayload));
    }

    public TelemetryRecord withId(String newId) {
        return new TelemetryRecord(newId, facilityId, timestamp, energyKwh, voltage, currentAmps, powerWatts, rawPayload);
    }
}
