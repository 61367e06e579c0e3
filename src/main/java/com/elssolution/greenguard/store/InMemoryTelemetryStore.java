package com.elssolution.greenguard.store;

import com.elssolution.greenguard.domain.TelemetryRecord;
import org.springframework.stereotype.Repository;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

@Repository
public class InMemoryTelemetryStore implements TelemetryStore {

    private final Map<String, TelemetryRecord> readings = new ConcurrentHashMap<>();

    @Override
    public TelemetryRecord save(TelemetryRecord reading) {
        String id = (reading.id() == null || reading.id().isBlank()) ? UUID.randomUUID().toString() : reading.id();
        TelemetryRecord stored = reading.withId(id);
        readings.put(id, stored);
        return stored;
    }

    @Override
    public Optional<TelemetryRecord> findById(String telemetryId) {
        if (telemetryId == null) return Optional.empty();
        return Optional.ofNullable(readings.get(telemetryId));
    }

    @Override
    public List<TelemetryRecord> findRecentByFacility(String facilityId, int limit) {
        return readings.values().stream()
                .filter(r -> r.facilityId().equals(facilityId))
                .sorted(Comparator.comparing(TelemetryRecord::timestamp).reversed())
                .limit(Math.max(0, limit))
                .toList();
    }
}
