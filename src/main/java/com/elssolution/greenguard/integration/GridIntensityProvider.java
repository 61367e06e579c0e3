package com.elssolution.greenguard.integration;

import java.time.Instant;
import java.util.concurrent.CompletableFuture;

/** Live grid carbon intensity (g CO2/kWh). Implementations complete exceptionally on any failure. */
public interface GridIntensityProvider {

    boolean isConfigured();

    CompletableFuture<Double> fetchIntensity(double latitude, double longitude, Instant at);
}
