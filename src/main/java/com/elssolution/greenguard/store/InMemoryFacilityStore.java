package com.elssolution.greenguard.store;

import com.elssolution.greenguard.domain.FacilityRules;
import org.springframework.stereotype.Repository;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

@Repository
public class InMemoryFacilityStore implements FacilityStore {

    private final Map<String, FacilityRules> facilities = new ConcurrentHashMap<>();

    @Override
    public Optional<FacilityRules> findById(String facilityId) {
        if (facilityId == null) return Optional.empty();
        return Optional.ofNullable(facilities.get(facilityId));
    }

    @Override
    public List<FacilityRules> findAll() {
        return facilities.values().stream()
                .sorted(Comparator.comparing(FacilityRules::getName, Comparator.nullsLast(Comparator.naturalOrder())))
                .toList();
    }

    @Override
    public FacilityRules save(FacilityRules rules) {
        facilities.put(rules.getFacilityId(), rules);
        return rules;
    }
}
