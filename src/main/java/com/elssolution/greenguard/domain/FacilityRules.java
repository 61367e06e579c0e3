package com.elssolution.greenguard.domain;

import lombok.Builder;
import lombok.Value;

/**
 * Contract data for one facility: load ceiling from the electricity bill and the grid
 * carbon baseline. The store swaps whole snapshots when a new bill arrives.
 */
@Value
@Builder(toBuilder = true)
public class FacilityRules {
    String facilityId;
    String name;
    double maxLoadKwh;
    /** g CO2 per kWh. */
    double baselineCarbonIntensity;
    GeoLocation location;

    /** Throws if the ceiling cannot be used as a divisor. */
    public FacilityRules requireValid() {
        if (!(maxLoadKwh > 0) || !Double.isFinite(maxLoadKwh)) {
            throw new InvalidFacilityRulesException(
                    "maxLoadKwh must be > 0 for facility " + facilityId + ", got " + maxLoadKwh);
        }
        return this;
    }

    public GeoLocation locationOrUnknown() {
        return location == null ? GeoLocation.UNKNOWN : location;
    }
}
