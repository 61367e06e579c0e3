package com.elssolution.greenguard.service;

import com.elssolution.greenguard.domain.FacilityRules;
import com.elssolution.greenguard.domain.UnknownFacilityException;
import com.elssolution.greenguard.store.FacilityStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

@Slf4j
@Service
@RequiredArgsConstructor
public class FacilityRulesService {

    private final FacilityStore facilities;

    public List<FacilityRules> list() {
        return facilities.findAll();
    }

    public FacilityRules get(String facilityId) {
        return facilities.findById(facilityId).orElseThrow(() -> new UnknownFacilityException(facilityId));
    }

    /**
     * Replaces the ceiling and carbon baseline from a new bill. Runs already in flight keep
     * the snapshot they loaded.
     */
    public FacilityRules updateRules(String facilityId, double maxLoadKwh, double baselineCarbonIntensity) {
        FacilityRules updated = get(facilityId).toBuilder()
                .maxLoadKwh(maxLoadKwh)
                .baselineCarbonIntensity(baselineCarbonIntensity)
                .build()
                .requireValid();
        facilities.save(updated);
        log.info("facility_rules_updated facility={} maxLoadKwh={} baseline={}",
                facilityId, maxLoadKwh, baselineCarbonIntensity);
        return updated;
    }

    public FacilityRules register(FacilityRules rules) {
        FacilityRules valid = rules.requireValid();
        facilities.save(valid);
        log.info("facility_registered facility={} name={}", valid.getFacilityId(), valid.getName());
        return valid;
    }
}
