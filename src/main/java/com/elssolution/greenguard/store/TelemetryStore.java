package com.elssolution.greenguard.store;

import com.elssolution.greenguard.domain.TelemetryRecord;

import java.util.List;
import java.util.Optional;

public interface TelemetryStore {

    /** Stores the reading under a fresh id and returns the stored copy. */
    TelemetryRecord save(TelemetryRecord reading);

    Optional<TelemetryRecord> findById(String telemetryId);

    /** Newest first, at most {@code limit} readings. */
    List<TelemetryRecord> findRecentByFacility(String facilityId, int limit);
}
