package com.elssolution.greenguard.service;

import com.elssolution.greenguard.domain.ContextSnapshot;
import com.elssolution.greenguard.domain.GeoLocation;
import com.elssolution.greenguard.domain.Provenance;
import com.elssolution.greenguard.domain.SourceProvenance;
import com.elssolution.greenguard.integration.GridIntensityProvider;
import com.elssolution.greenguard.integration.WeatherProvider;
import com.elssolution.greenguard.integration.WeatherProvider.LiveWeather;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.*;
import java.util.function.Supplier;

/**
 * Weather + grid context for a reading. Both live lookups start together, each with its
 * own deadline; whatever is missing afterwards is filled from {@link SyntheticContext}.
 * Never throws.
 */
@Slf4j
@Service
public class ContextEnricher {

    private final WeatherProvider weatherProvider;
    private final GridIntensityProvider gridProvider;
    private final SyntheticContext synthetic;
    private final long weatherTimeoutMs;
    private final long gridTimeoutMs;

    public ContextEnricher(WeatherProvider weatherProvider,
                           GridIntensityProvider gridProvider,
                           SyntheticContext synthetic,
                           @Value("${audit.context.weatherTimeoutMs:4000}") long weatherTimeoutMs,
                           @Value("${audit.context.gridTimeoutMs:4000}") long gridTimeoutMs) {
        this.weatherProvider = weatherProvider;
        this.gridProvider = gridProvider;
        this.synthetic = synthetic;
        this.weatherTimeoutMs = Math.max(1, weatherTimeoutMs);
        this.gridTimeoutMs = Math.max(1, gridTimeoutMs);
    }

    public ContextSnapshot enrich(GeoLocation location, Instant timestamp) {
        GeoLocation loc = location == null ? GeoLocation.UNKNOWN : location;
        Instant at = timestamp == null ? Instant.now() : timestamp;
        List<String> reasons = new ArrayList<>();

        CompletableFuture<LiveWeather> weatherF = launch("weather", weatherProvider.isConfigured(), loc,
                () -> weatherProvider.fetchWeather(loc.latitude(), loc.longitude()), weatherTimeoutMs);
        CompletableFuture<Double> gridF = launch("grid", gridProvider.isConfigured(), loc,
                () -> gridProvider.fetchIntensity(loc.latitude(), loc.longitude(), at), gridTimeoutMs);

        LiveWeather liveWeather = null;
        Double liveGrid = null;
        try {
            liveWeather = await(weatherF, "weather", weatherTimeoutMs, reasons);
            liveGrid = await(gridF, "grid", gridTimeoutMs, reasons);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            weatherF.cancel(true);
            gridF.cancel(true);
            reasons.add("context lookups cancelled");
            log.info("context_cancelled location={}", loc.name());
        }

        Provenance weatherSource = liveWeather != null ? Provenance.API : Provenance.SYNTHETIC;
        Provenance gridSource = liveGrid != null ? Provenance.API : Provenance.SYNTHETIC;
        LiveWeather w = liveWeather != null ? liveWeather : synthetic.weather(loc, at);
        double grid = liveGrid != null ? liveGrid : synthetic.gridIntensity(loc, at);

        ContextSnapshot snapshot = new ContextSnapshot(
                w.temperatureC(),
                w.condition() == null || w.condition().isBlank() ? "Unknown" : w.condition(),
                w.humidityPct(),
                grid,
                new SourceProvenance(weatherSource, gridSource),
                at,
                reasons);

        log.debug("context location={} weather={} grid={} temp={}C carbon={}g/kWh",
                loc.name(), weatherSource.label(), gridSource.label(), snapshot.temperatureC(), snapshot.gridCarbonIntensity());
        return snapshot;
    }

    private <T> CompletableFuture<T> launch(String what, boolean configured, GeoLocation loc,
                                            Supplier<CompletableFuture<T>> call, long timeoutMs) {
        if (!configured) {
            return CompletableFuture.failedFuture(new SourceUnavailableException(what + " provider not configured"));
        }
        if (!loc.hasValidCoordinates()) {
            return CompletableFuture.failedFuture(new SourceUnavailableException(
                    what + " lookup skipped: invalid coordinates " + loc.latitude() + "," + loc.longitude()));
        }
        try {
            CompletableFuture<T> f = call.get();
            if (f == null) {
                return CompletableFuture.failedFuture(new SourceUnavailableException(what + " provider returned nothing"));
            }
            return f.orTimeout(timeoutMs, TimeUnit.MILLISECONDS);
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    private <T> T await(CompletableFuture<T> f, String what, long timeoutMs, List<String> reasons)
            throws InterruptedException {
        try {
            T value = f.get();
            if (value == null) reasons.add(what + " provider returned no value");
            return value;
        } catch (ExecutionException e) {
            reasons.add(describe(what, e.getCause(), timeoutMs));
            return null;
        } catch (CancellationException e) {
            reasons.add(what + " lookup cancelled");
            return null;
        }
    }

    private static String describe(String what, Throwable cause, long timeoutMs) {
        Throwable t = cause instanceof CompletionException && cause.getCause() != null ? cause.getCause() : cause;
        if (t instanceof TimeoutException) return what + " lookup timed out after " + timeoutMs + " ms";
        if (t instanceof SourceUnavailableException) return t.getMessage();
        return what + " lookup failed: " + t.getClass().getSimpleName() + (t.getMessage() == null ? "" : ": " + t.getMessage());
    }

    static class SourceUnavailableException extends RuntimeException {
        SourceUnavailableException(String message) {
            super(message);
        }
    }
}
