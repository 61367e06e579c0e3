package com.elssolution.greenguard.integration;

import java.util.concurrent.CompletableFuture;

/** Live weather lookup. Implementations complete exceptionally on any failure. */
public interface WeatherProvider {

    /** False when no credential is set; callers go synthetic without calling. */
    boolean isConfigured();

    CompletableFuture<LiveWeather> fetchWeather(double latitude, double longitude);

    record LiveWeather(double temperatureC, String condition, int humidityPct) {}
}
