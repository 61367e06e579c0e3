package com.elssolution.greenguard.integration.telegram;

import com.elssolution.greenguard.alerts.AlertService;
import com.elssolution.greenguard.domain.AuditVerdict;
import com.elssolution.greenguard.service.ReviewNotifier;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import jakarta.annotation.PostConstruct;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.*;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.*;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Telegram delivery for operational alerts and for verdicts that need a reviewer.
 */
@Slf4j
@Component
public class TelegramAlertSink implements AlertService.AlertSink, ReviewNotifier {

    @Value("${alert.telegram.enabled:false}")     private boolean enabled;
    @Value("${alert.telegram.botToken:}")         private String botToken;
    @Value("${alert.telegram.chatIds:}")          private String chatIdsCsv;     // comma-separated
    @Value("${alert.telegram.cooldownMs:900000}") private long cooldownMs;
    @Value("${alert.telegram.prefix:}")           String prefix;                 // deployment tag

    private final HttpClient http = HttpClient.newBuilder()
            .connectTimeout(Duration.ofSeconds(4))
            .build();
    private final Map<String, Long> lastSent = new ConcurrentHashMap<>();
    private List<String> targets = List.of();

    String apiUrl() { return "https://api.telegram.org/bot" + botToken + "/sendMessage"; }

    @PostConstruct
    void init() {
        targets = Arrays.stream(Optional.ofNullable(chatIdsCsv).orElse("")
                        .split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .toList();
        log.info("Telegram sink registered: enabled={} tokenSet={} targets={}",
                enabled, botToken != null && !botToken.isBlank(), targets);
    }

    @Override
    public boolean isEnabled() {
        return enabled && botToken != null && !botToken.isBlank() && !targets.isEmpty();
    }

    @Override public void onRaise(AlertService.AlertView a) {
        if (!isEnabled()) return;
        long now = System.currentTimeMillis();
        Long last = lastSent.get(a.getKey());
        if (last != null && (now - last) < cooldownMs) return;

        String text = header() +
                "⚠️ *" + a.getSeverity() + "* `" + esc(a.getKey()) + "`\n" +
                esc(a.getMessage()) + "\n" +
                "_firstSeen:_ " + Instant.ofEpochMilli(a.getFirstSeen()) + "\n" +
                "_lastSeen:_ " + Instant.ofEpochMilli(a.getLastSeen());
        if (sendToAll(text)) lastSent.put(a.getKey(), now);
    }

    @Override public void onResolve(AlertService.AlertView a) {
        if (!isEnabled()) return;
        String text = header() +
                "✅ *RECOVERED* `" + esc(a.getKey()) + "`\n" +
                "_lastSeen:_ " + Instant.ofEpochMilli(a.getLastSeen());
        sendToAll(text);
        lastSent.remove(a.getKey());
    }

    @Override
    public boolean notifyReviewRequired(AuditVerdict verdict) {
        if (!isEnabled()) return false;
        String marker = verdict.requiresAction() ? "🚨 *ACTION REQUIRED*" : "🔔 *REVIEW*";
        String text = header() +
                marker + " " + verdict.getSeverity() + " (" + verdict.getConfidence() + "%)\n" +
                "_audit:_ `" + esc(verdict.getId()) + "`\n" +
                "_reading:_ `" + esc(verdict.getTelemetryId()) + "`\n" +
                esc(verdict.getReasoning());
        return sendToAll(text);
    }

    public boolean sendWithPrefix(String bodyMarkdown) {
        if (!isEnabled()) return false;
        return sendToAll(header() + bodyMarkdown);
    }

    private boolean sendToAll(String markdownText) {
        boolean ok = true;
        for (String chatId : targets) ok &= sendOne(chatId, markdownText);
        return ok;
    }

    private boolean sendOne(String chatId, String markdownText) {
        try {
            String body = "chat_id=" + url(chatId)
                    + "&parse_mode=Markdown"
                    + "&text=" + url(markdownText);
            HttpRequest req = HttpRequest.newBuilder()
                    .uri(URI.create(apiUrl()))
                    .header("Content-Type", "application/x-www-form-urlencoded")
                    .timeout(Duration.ofSeconds(8))
                    .POST(HttpRequest.BodyPublishers.ofString(body))
                    .build();
            HttpResponse<String> resp = http.send(req, HttpResponse.BodyHandlers.ofString());
            boolean ok = resp.statusCode() / 100 == 2;
            if (!ok) log.warn("Telegram send failed ({}): {}", resp.statusCode(), resp.body());
            else     log.info("Telegram sent to {} ({})", chatId, resp.statusCode());
            return ok;
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            return false;
        } catch (Exception e) {
            log.warn("Telegram send exception to {}: {}", chatId, e.toString());
            return false;
        }
    }

    private String header() {
        return (prefix == null || prefix.isBlank()) ? "" : "*" + esc(prefix) + "*\n";
    }

    private static String url(String s) { return URLEncoder.encode(s, StandardCharsets.UTF_8); }
    private static String esc(String s) { return s == null ? "" : s.replace("_","\\_").replace("*","\\*").replace("`","\\`"); }
}
