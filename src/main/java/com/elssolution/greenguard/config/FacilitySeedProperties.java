package com.elssolution.greenguard.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

/** {@code audit.facilities[*]}: facilities loaded at startup. */
@Getter
@Setter
@ConfigurationProperties(prefix = "audit")
public class FacilitySeedProperties {

    private List<Facility> facilities = new ArrayList<>();

    @Getter
    @Setter
    public static class Facility {
        private String id;
        private String name;
        private double maxLoadKwh;
        private double baselineCarbonIntensity;
        private String locationName;
        private double latitude;
        private double longitude;
    }
}
