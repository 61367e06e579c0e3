package com.elssolution.greenguard.domain;

public class TelemetryValidationException extends RuntimeException {
    public TelemetryValidationException(String message) {
        super(message);
    }
}
