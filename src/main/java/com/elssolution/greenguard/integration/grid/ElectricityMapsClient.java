package com.elssolution.greenguard.integration.grid;

import com.elssolution.greenguard.alerts.AlertService;
import com.elssolution.greenguard.integration.GridIntensityProvider;
import com.elssolution.greenguard.integration.ProviderException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Locale;
import java.util.concurrent.CompletableFuture;

import static com.elssolution.greenguard.integration.HttpSupport.*;

/**
 * ElectricityMaps carbon-intensity client. Readings older than an hour use the
 * {@code /past} endpoint, everything else {@code /latest}.
 */
@Slf4j
@Service
public class ElectricityMapsClient implements GridIntensityProvider {

    @Value("${audit.grid.apiKey:}")                                private String apiKey;
    @Value("${audit.grid.uri:https://api.electricitymaps.com}")    private String baseUri;
    @Value("${audit.grid.requestTimeoutMs:5000}")                  private int requestTimeoutMs;

    private static final String PATH_LATEST = "/v3/carbon-intensity/latest";
    private static final String PATH_PAST   = "/v3/carbon-intensity/past";

    private final HttpClient httpClient;
    private final ObjectMapper objectMapper = new ObjectMapper();
    private final AlertService alerts;

    public ElectricityMapsClient(AlertService alerts) {
        this.alerts = alerts;
        this.httpClient = HttpClient.newBuilder()
                .version(HttpClient.Version.HTTP_1_1)
                .connectTimeout(Duration.ofSeconds(3))
                .build();
    }

    @Override
    public boolean isConfigured() {
        return apiKey != null && !apiKey.isBlank();
    }

    @Override
    public CompletableFuture<Double> fetchIntensity(double latitude, double longitude, Instant at) {
        boolean historical = at != null && at.isBefore(Instant.now().minus(1, ChronoUnit.HOURS));
        String coords = String.format(Locale.ROOT, "?lat=%.4f&lon=%.4f", latitude, longitude);
        String url = historical
                ? safeJoin(baseUri, PATH_PAST) + coords + "&datetime="
                        + URLEncoder.encode(at.truncatedTo(ChronoUnit.MINUTES).toString(), StandardCharsets.UTF_8)
                : safeJoin(baseUri, PATH_LATEST) + coords;

        HttpRequest req = HttpRequest.newBuilder()
                .uri(URI.create(url))
                .header("Accept", "application/json")
                .header("auth-token", apiKey)
                .timeout(Duration.ofMillis(Math.max(500, requestTimeoutMs)))
                .GET()
                .build();

        CompletableFuture<HttpResponse<String>> exchange = httpClient.sendAsync(req, HttpResponse.BodyHandlers.ofString());
        return linkCancellation(exchange
                .thenApply(this::parse)
                .whenComplete((v, ex) -> {
                    if (ex != null) {
                        alerts.raise(AlertService.GRID_API_DOWN, "Grid lookup failed: " + ex.getMessage(),
                                AlertService.Severity.WARN);
                    } else {
                        alerts.resolve(AlertService.GRID_API_DOWN);
                    }
                }), exchange);
    }

    Double parse(HttpResponse<String> resp) {
        int sc = resp.statusCode();
        if (sc == 401 || sc == 403) {
            throw new ProviderException("ElectricityMaps HTTP " + sc + " — check auth token");
        }
        if (sc / 100 != 2) {
            throw new ProviderException("ElectricityMaps HTTP " + sc + " — " + truncate(resp.body(), 200));
        }
        try {
            JsonNode root = objectMapper.readTree(resp.body());
            Double intensity = nodeNum(root, "carbonIntensity");
            if (intensity == null || intensity < 0) {
                throw new ProviderException("ElectricityMaps response missing carbonIntensity");
            }
            log.debug("grid_live intensity={} zone={}", intensity, root.path("zone").asText("-"));
            return (double) Math.round(intensity);
        } catch (ProviderException pe) {
            throw pe;
        } catch (Exception e) {
            throw new ProviderException("ElectricityMaps body unparsable: " + e.getMessage(), e);
        }
    }
}
