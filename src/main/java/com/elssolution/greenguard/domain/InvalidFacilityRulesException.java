package com.elssolution.greenguard.domain;

public class InvalidFacilityRulesException extends RuntimeException {
    public InvalidFacilityRulesException(String message) {
        super(message);
    }
}
