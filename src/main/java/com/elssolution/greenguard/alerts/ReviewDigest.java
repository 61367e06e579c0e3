package com.elssolution.greenguard.alerts;

import com.elssolution.greenguard.domain.Severity;
import com.elssolution.greenguard.service.AuditReviewService;
import com.elssolution.greenguard.integration.telegram.TelegramAlertSink;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.Map;

/** Daily summary of the review queue, sent through Telegram. */
@Component
public class ReviewDigest {

    private final TelegramAlertSink sink;
    private final AuditReviewService reviews;

    @Value("${audit.digest.enabled:true}")
    boolean enabled;

    public ReviewDigest(TelegramAlertSink sink, AuditReviewService reviews) {
        this.sink = sink;
        this.reviews = reviews;
    }

    @Scheduled(cron = "${audit.digest.cron:0 0 9 * * *}")
    public void dailyDigest() {
        if (!enabled || !sink.isEnabled()) return;
        sink.sendWithPrefix(buildMessage());
    }

    String buildMessage() {
        Map<Severity, Long> pending = reviews.pendingCountBySeverity();
        long anomalies = pending.getOrDefault(Severity.ANOMALY, 0L);
        long warnings = pending.getOrDefault(Severity.WARNING, 0L);
        return "*REVIEW DIGEST* " + (anomalies + warnings == 0 ? "queue empty" : (anomalies + warnings) + " pending") + "\n" +
                "_anomalies:_ " + anomalies + "\n" +
                "_warnings:_ " + warnings;
    }
}
