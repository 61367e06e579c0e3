package com.elssolution.greenguard.integration.weather;

import com.elssolution.greenguard.alerts.AlertService;
import com.elssolution.greenguard.integration.ProviderException;
import com.elssolution.greenguard.integration.WeatherProvider;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Locale;
import java.util.concurrent.CompletableFuture;

import static com.elssolution.greenguard.integration.HttpSupport.*;

/**
 * OpenWeatherMap current-weather client. Metric units, so temperature arrives in °C.
 */
@Slf4j
@Service
public class OpenWeatherClient implements WeatherProvider {

    @Value("${audit.weather.apiKey:}")                              private String apiKey;
    @Value("${audit.weather.uri:https://api.openweathermap.org}")   private String baseUri;
    /** Transport timeout; the enricher applies its own, usually shorter, deadline. */
    @Value("${audit.weather.requestTimeoutMs:5000}")                private int requestTimeoutMs;

    private static final String PATH_WEATHER = "/data/2.5/weather";

    private final HttpClient httpClient;
    private final ObjectMapper objectMapper = new ObjectMapper();
    private final AlertService alerts;

    public OpenWeatherClient(AlertService alerts) {
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
    public CompletableFuture<LiveWeather> fetchWeather(double latitude, double longitude) {
        String query = String.format(Locale.ROOT, "?lat=%.4f&lon=%.4f&units=metric&appid=%s", latitude, longitude, apiKey);
        HttpRequest req = HttpRequest.newBuilder()
                .uri(URI.create(safeJoin(baseUri, PATH_WEATHER) + query))
                .header("Accept", "application/json")
                .timeout(Duration.ofMillis(Math.max(500, requestTimeoutMs)))
                .GET()
                .build();

        CompletableFuture<HttpResponse<String>> exchange = httpClient.sendAsync(req, HttpResponse.BodyHandlers.ofString());
        return linkCancellation(exchange
                .thenApply(this::parse)
                .whenComplete((w, ex) -> {
                    if (ex != null) {
                        alerts.raise(AlertService.WEATHER_API_DOWN, "Weather lookup failed: " + rootMessage(ex),
                                AlertService.Severity.WARN);
                    } else {
                        alerts.resolve(AlertService.WEATHER_API_DOWN);
                    }
                }), exchange);
    }

    LiveWeather parse(HttpResponse<String> resp) {
        int sc = resp.statusCode();
        if (sc / 100 != 2) {
            throw new ProviderException("OpenWeather HTTP " + sc + " — " + truncate(resp.body(), 200));
        }
        try {
            JsonNode root = objectMapper.readTree(resp.body());
            JsonNode main = root.path("main");
            Double temp = nodeNum(main, "temp");
            Double humidity = nodeNum(main, "humidity");
            if (temp == null || humidity == null) {
                throw new ProviderException("OpenWeather response missing main.temp/main.humidity");
            }
            String condition = root.path("weather").path(0).path("main").asText("Unknown");
            if (condition.isBlank()) condition = "Unknown";

            if (log.isDebugEnabled()) {
                log.debug("weather_live temp={}C humidity={}% condition={}", temp, humidity, condition);
            }
            return new LiveWeather(Math.round(temp * 10.0) / 10.0, condition, (int) Math.round(humidity));
        } catch (ProviderException pe) {
            throw pe;
        } catch (Exception e) {
            throw new ProviderException("OpenWeather body unparsable: " + e.getMessage(), e);
        }
    }

    private static String rootMessage(Throwable ex) {
        Throwable t = ex;
        while (t.getCause() != null && t.getCause() != t) t = t.getCause();
        return t.getClass().getSimpleName() + ": " + t.getMessage();
    }
}
