package com.elssolution.greenguard.service;

import com.elssolution.greenguard.domain.ClassifierVerdict;
import com.elssolution.greenguard.integration.TextCompletionProvider;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * AI classification with a guaranteed answer: provider missing, slow, failing or talking
 * nonsense all end in {@link FallbackClassifier}. Never throws.
 */
@Slf4j
@Service
public class AiClassifierAdapter {

    private final TextCompletionProvider provider;
    private final AiPromptBuilder prompts;
    private final AiResponseParser parser;
    private final FallbackClassifier fallback;
    private final Duration timeout;

    public AiClassifierAdapter(TextCompletionProvider provider,
                               AiPromptBuilder prompts,
                               AiResponseParser parser,
                               FallbackClassifier fallback,
                               @Value("${audit.ai.timeoutMs:12000}") long timeoutMs) {
        this.provider = provider;
        this.prompts = prompts;
        this.parser = parser;
        this.fallback = fallback;
        this.timeout = Duration.ofMillis(Math.max(1, timeoutMs));
    }

    public AiOutcome classify(ClassificationInput in) {
        if (!provider.isConfigured()) {
            return useFallback(in, "AI provider not configured");
        }
        String raw;
        try {
            raw = provider.complete(prompts.build(in), timeout);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            return useFallback(in, "AI call interrupted");
        } catch (Exception e) {
            log.warn("ai_call_failed facility={} err={}", in.rules().getFacilityId(), e.toString());
            return useFallback(in, "AI call failed: " + e.getClass().getSimpleName()
                    + (e.getMessage() == null ? "" : ": " + e.getMessage()));
        }

        try {
            ClassifierVerdict v = parser.parse(raw);
            log.debug("ai_verdict facility={} severity={} confidence={}",
                    in.rules().getFacilityId(), v.severity(), v.confidence());
            return AiOutcome.primary(v);
        } catch (RuntimeException e) {
            log.warn("ai_response_rejected facility={} reason={}", in.rules().getFacilityId(), e.getMessage());
            return useFallback(in, "AI response unusable: " + e.getMessage());
        }
    }

    private AiOutcome useFallback(ClassificationInput in, String reason) {
        ClassifierVerdict v = fallback.classify(in.reading(), in.context(), in.rules(), in.analysis());
        return AiOutcome.fallback(v, reason);
    }
}
