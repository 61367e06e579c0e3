package com.elssolution.greenguard.store;

import com.elssolution.greenguard.domain.FacilityRules;

import java.util.List;
import java.util.Optional;

public interface FacilityStore {

    Optional<FacilityRules> findById(String facilityId);

    List<FacilityRules> findAll();

    /** Insert or replace the whole rules snapshot. */
    FacilityRules save(FacilityRules rules);
}
