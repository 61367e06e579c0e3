package com.elssolution.greenguard.integration.gemini;

import com.elssolution.greenguard.alerts.AlertService;
import com.elssolution.greenguard.integration.ProviderException;
import com.elssolution.greenguard.integration.TextCompletionProvider;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;

import static com.elssolution.greenguard.integration.HttpSupport.*;

/**
 * Gemini {@code generateContent} over plain HTTP. One attempt per call: the classifier
 * has a local fallback, so nothing is retried here.
 */
@Slf4j
@Service
public class GeminiClient implements TextCompletionProvider {

    @Value("${audit.ai.apiKey:}")                                            private String apiKey;
    @Value("${audit.ai.uri:https://generativelanguage.googleapis.com}")      private String baseUri;
    @Value("${audit.ai.model:gemini-1.5-flash}")                             private String model;
    @Value("${audit.ai.temperature:0.2}")                                    private double temperature;

    private final HttpClient httpClient = HttpClient.newBuilder()
            .version(HttpClient.Version.HTTP_1_1)
            .connectTimeout(Duration.ofSeconds(4))
            .build();
    private final ObjectMapper objectMapper = new ObjectMapper();
    private final AlertService alerts;

    public GeminiClient(AlertService alerts) {
        this.alerts = alerts;
    }

    @Override
    public boolean isConfigured() {
        return apiKey != null && !apiKey.isBlank();
    }

    @Override
    public String complete(String prompt, Duration timeout) throws IOException, InterruptedException {
        String path = "/v1beta/models/" + model + ":generateContent";
        HttpRequest req = HttpRequest.newBuilder()
                .uri(URI.create(safeJoin(baseUri, path)))
                .header("Content-Type", "application/json")
                .header("Accept", "application/json")
                .header("x-goog-api-key", apiKey)
                .timeout(timeout)
                .POST(HttpRequest.BodyPublishers.ofString(requestBody(prompt)))
                .build();

        HttpResponse<String> resp;
        try {
            resp = httpClient.send(req, HttpResponse.BodyHandlers.ofString());
        } catch (HttpTimeoutException e) {
            alerts.raise(AlertService.AI_PROVIDER_DOWN, "Gemini timeout after " + timeout.toMillis() + " ms",
                    AlertService.Severity.WARN);
            throw e;
        } catch (IOException e) {
            alerts.raise(AlertService.AI_PROVIDER_DOWN, "Gemini I/O error: " + e.getMessage(), AlertService.Severity.WARN);
            throw e;
        }

        int sc = resp.statusCode();
        if (sc / 100 != 2) {
            String msg = switch (sc) {
                case 401, 403 -> "HTTP " + sc + " — check API key";
                case 429 -> "HTTP 429 — rate limited";
                default -> "HTTP " + sc + " — " + truncate(resp.body(), 240);
            };
            AlertService.Severity sev = (sc == 401 || sc == 403) ? AlertService.Severity.ERROR : AlertService.Severity.WARN;
            alerts.raise(AlertService.AI_PROVIDER_DOWN, "Gemini " + msg, sev);
            throw new IOException("Gemini " + msg);
        }

        String text;
        try {
            text = extractText(resp.body());
        } catch (ProviderException | IOException e) {
            alerts.raise(AlertService.AI_PROVIDER_DOWN, e.getMessage(), AlertService.Severity.WARN);
            throw e;
        }
        alerts.resolve(AlertService.AI_PROVIDER_DOWN);
        return text;
    }

    String requestBody(String prompt) throws IOException {
        ObjectNode root = objectMapper.createObjectNode();
        root.putArray("contents").addObject()
                .putArray("parts").addObject()
                .put("text", prompt);
        root.putObject("generationConfig")
                .put("temperature", temperature)
                .put("responseMimeType", "application/json");
        return objectMapper.writeValueAsString(root);
    }

    /** First candidate's text parts, concatenated. */
    String extractText(String body) throws IOException {
        JsonNode root = objectMapper.readTree(body);
        JsonNode parts = root.path("candidates").path(0).path("content").path("parts");
        if (!parts.isArray() || parts.isEmpty()) {
            String finish = root.path("candidates").path(0).path("finishReason").asText("none");
            throw new ProviderException("Gemini returned no text (finishReason=" + finish + ")");
        }
        StringBuilder sb = new StringBuilder();
        for (JsonNode p : parts) sb.append(p.path("text").asText(""));
        return sb.toString();
    }
}
