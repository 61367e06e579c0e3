package com.elssolution.greenguard.domain;

public class UnknownFacilityException extends RuntimeException {
    public UnknownFacilityException(String facilityId) {
        super("Facility not found: " + facilityId);
    }
}
