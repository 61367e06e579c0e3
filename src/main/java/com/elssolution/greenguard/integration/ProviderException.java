package com.elssolution.greenguard.integration;

/** Non-2xx answer or unusable body from an external provider. */
public class ProviderException extends RuntimeException {
    public ProviderException(String message) {
        super(message);
    }

    public ProviderException(String message, Throwable cause) {
        super(message, cause);
    }
}
