package com.elssolution.greenguard.service;

import com.elssolution.greenguard.domain.TelemetryRecord;
import com.elssolution.greenguard.domain.TelemetryValidationException;
import com.elssolution.greenguard.domain.UnknownFacilityException;
import com.elssolution.greenguard.store.FacilityStore;
import com.elssolution.greenguard.store.TelemetryStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.Map;

/**
 * Inbound boundary: validates a raw reading, stores it and queues its audit.
 * The caller gets the telemetry id back before the audit runs.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class IngestionService {

    private final TelemetryStore telemetry;
    private final FacilityStore facilities;
    private final AuditPipelineOrchestrator orchestrator;

    public TelemetryRecord ingest(Map<String, Object> payload) {
        if (payload == null) throw new TelemetryValidationException("empty payload");

        String facilityId = text(payload, "facility_id");
        if (facilityId == null) throw new TelemetryValidationException("facility_id is required");
        if (facilities.findById(facilityId).isEmpty()) throw new UnknownFacilityException(facilityId);

        Double energy = number(payload, "energy_kwh");
        if (energy == null) throw new TelemetryValidationException("energy_kwh is required");

        TelemetryRecord reading = new TelemetryRecord(
                null,
                facilityId,
                timestamp(payload),
                energy,
                orZero(number(payload, "voltage")),
                orZero(number(payload, "current_amps")),
                orZero(number(payload, "power_watts")),
                payload);

        TelemetryRecord stored = telemetry.save(reading);
        log.info("telemetry_ingested id={} facility={} energyKwh={}", stored.id(), facilityId, energy);
        orchestrator.submit(stored.id());
        return stored;
    }

    private static Instant timestamp(Map<String, Object> payload) {
        String ts = text(payload, "timestamp");
        if (ts == null) return Instant.now();
        try {
            return Instant.parse(ts);
        } catch (DateTimeParseException e) {
            throw new TelemetryValidationException("timestamp is not ISO-8601: " + ts);
        }
    }

    private static String text(Map<String, Object> payload, String key) {
        Object v = payload.get(key);
        if (v == null) return null;
        String s = v.toString().trim();
        return s.isEmpty() ? null : s;
    }

    private static Double number(Map<String, Object> payload, String key) {
        Object v = payload.get(key);
        if (v == null) return null;
        if (v instanceof Number n) return n.doubleValue();
        try {
            return Double.parseDouble(v.toString().trim());
        } catch (NumberFormatException e) {
            throw new TelemetryValidationException(key + " must be numeric, got " + v);
        }
    }

    private static double orZero(Double d) {
        return d == null ? 0.0 : d;
    }
}
