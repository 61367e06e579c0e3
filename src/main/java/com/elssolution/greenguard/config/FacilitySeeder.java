package com.elssolution.greenguard.config;

import com.elssolution.greenguard.domain.FacilityRules;
import com.elssolution.greenguard.domain.GeoLocation;
import com.elssolution.greenguard.service.FacilityRulesService;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Slf4j
@Configuration
@RequiredArgsConstructor
@EnableConfigurationProperties(FacilitySeedProperties.class)
public class FacilitySeeder {

    private final FacilitySeedProperties properties;
    private final FacilityRulesService facilities;

    @PostConstruct
    void seed() {
        for (FacilitySeedProperties.Facility f : properties.getFacilities()) {
            facilities.register(FacilityRules.builder()
                    .facilityId(f.getId())
                    .name(f.getName())
                    .maxLoadKwh(f.getMaxLoadKwh())
                    .baselineCarbonIntensity(f.getBaselineCarbonIntensity())
                    .location(new GeoLocation(f.getLocationName(), f.getLatitude(), f.getLongitude()))
                    .build());
        }
        log.info("Seeded {} facilities", properties.getFacilities().size());
    }
}
