package com.elssolution.greenguard.service;

import com.elssolution.greenguard.domain.ClassifierVerdict;
import com.elssolution.greenguard.domain.ContextualAnalysis;
import com.elssolution.greenguard.domain.Severity;
import com.elssolution.greenguard.domain.VerdictSource;
import com.elssolution.greenguard.integration.TextCompletionProvider;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.util.List;

import static com.elssolution.greenguard.service.Fixtures.*;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

class AiClassifierAdapterTest {

    private TextCompletionProvider provider;
    private AiClassifierAdapter adapter;

    @BeforeEach
    void setUp() {
        provider = mock(TextCompletionProvider.class);
        adapter = new AiClassifierAdapter(provider, new AiPromptBuilder(), new AiResponseParser(),
                new FallbackClassifier(), 12_000);
    }

    @Test
    void unconfigured_provider_uses_heuristic_without_calling() throws Exception {
        when(provider.isConfigured()).thenReturn(false);

        AiOutcome out = adapter.classify(ClassificationInput.of(reading(300), context(33, "Clear", 500), ahmedabad()));

        assertThat(out.usedFallback()).isTrue();
        assertThat(out.fallbackReason()).contains("not configured");
        assertThat(out.verdict().severity()).isEqualTo(Severity.VERIFIED);
        assertThat(out.verdict().confidence()).isEqualTo(80);
        assertThat(out.verdict().source()).isEqualTo(VerdictSource.AI_FALLBACK);
        verify(provider, never()).complete(anyString(), any());
    }

    @Test
    void valid_answer_takes_primary_path() throws Exception {
        when(provider.isConfigured()).thenReturn(true);
        when(provider.complete(anyString(), eq(Duration.ofMillis(12_000))))
                .thenReturn("```json\n{\"severity\":\"ANOMALY\",\"confidence\":88,\"reasoning\":\"Cool day, near ceiling\"}\n```");

        AiOutcome out = adapter.classify(ClassificationInput.of(reading(330), context(18, "Cloudy", 500), ahmedabad()));

        assertThat(out.usedFallback()).isFalse();
        assertThat(out.fallbackReason()).isNull();
        assertThat(out.verdict()).isEqualTo(
                new ClassifierVerdict(Severity.ANOMALY, 88, "Cool day, near ceiling", VerdictSource.AI_PRIMARY));
    }

    @Test
    void timeout_falls_back_and_over_twenty_percent_is_anomaly() throws Exception {
        when(provider.isConfigured()).thenReturn(true);
        when(provider.complete(anyString(), any())).thenThrow(new HttpTimeoutException("request timed out"));

        AiOutcome out = adapter.classify(ClassificationInput.of(reading(430), context(28, "Clear", 500), ahmedabad()));

        assertThat(out.usedFallback()).isTrue();
        assertThat(out.fallbackReason()).contains("HttpTimeoutException");
        assertThat(out.verdict().severity()).isEqualTo(Severity.ANOMALY);
        assertThat(out.verdict().confidence()).isEqualTo(85);
    }

    @Test
    void unparsable_answer_falls_back() throws Exception {
        when(provider.isConfigured()).thenReturn(true);
        when(provider.complete(anyString(), any())).thenReturn("I think this is WARNING.");

        AiOutcome out = adapter.classify(ClassificationInput.of(reading(200), context(28, "Clear", 500), ahmedabad()));

        assertThat(out.usedFallback()).isTrue();
        assertThat(out.fallbackReason()).startsWith("AI response unusable");
        assertThat(out.verdict().severity()).isEqualTo(Severity.VERIFIED);
    }

    @Test
    void interruption_falls_back_and_keeps_flag() throws Exception {
        when(provider.isConfigured()).thenReturn(true);
        when(provider.complete(anyString(), any())).thenThrow(new InterruptedException());

        AiOutcome out = adapter.classify(ClassificationInput.of(reading(200), context(28, "Clear", 500), ahmedabad()));

        assertThat(out.usedFallback()).isTrue();
        assertThat(Thread.interrupted()).isTrue();
    }

    @Test
    void fallback_heuristic_branches() {
        FallbackClassifier h = new FallbackClassifier();
        var rules = ahmedabad();

        assertThat(h.classify(reading(380), context(20, "Clear", 500), rules, null))
                .extracting(ClassifierVerdict::severity, ClassifierVerdict::confidence)
                .containsExactly(Severity.ANOMALY, 75);
        assertThat(h.classify(reading(380), context(36, "Clear", 500), rules, null))
                .extracting(ClassifierVerdict::severity, ClassifierVerdict::confidence)
                .containsExactly(Severity.WARNING, 60);
        assertThat(h.classify(reading(380), context(5.0, "Clear", 500), rules, null))
                .extracting(ClassifierVerdict::severity, ClassifierVerdict::confidence)
                .containsExactly(Severity.ANOMALY, 75);
        assertThat(h.classify(reading(380), context(32.0, "Clear", 500), rules, null))
                .extracting(ClassifierVerdict::severity, ClassifierVerdict::confidence)
                .containsExactly(Severity.ANOMALY, 75);
        assertThat(h.classify(reading(380), context(4.9, "Snow", 500), rules, null))
                .extracting(ClassifierVerdict::severity, ClassifierVerdict::confidence)
                .containsExactly(Severity.WARNING, 60);
        assertThat(h.classify(reading(320), context(20, "Clear", 500), rules, null))
                .extracting(ClassifierVerdict::severity, ClassifierVerdict::confidence)
                .containsExactly(Severity.WARNING, 70);
    }

    @Test
    void fallback_reasoning_carries_context_note() throws IOException {
        when(provider.isConfigured()).thenReturn(false);
        var analysis = new ContextualAnalysis(true, "High energy usage during cool weather", List.of("HIGH_ENERGY_COOL_WEATHER"));

        AiOutcome out = adapter.classify(new ClassificationInput(reading(300), context(18, "Clear", 500), ahmedabad(), analysis, 250.0));

        assertThat(out.verdict().reasoning()).endsWith("Context: High energy usage during cool weather");
    }

    @Test
    void prompt_lists_provenance_history_and_flags() {
        var analysis = new ContextualAnalysis(true, "cool", List.of("HIGH_ENERGY_COOL_WEATHER"));

        String prompt = new AiPromptBuilder().build(
                new ClassificationInput(reading(300), context(18, "Clear", 500), ahmedabad(), analysis, 275.5));

        assertThat(prompt)
                .contains("energy_kwh: 300.00")
                .contains("max_load_kwh: 350.00")
                .contains("[api]")
                .contains("historical_avg_kwh: 275.50")
                .contains("HIGH_ENERGY_COOL_WEATHER")
                .contains("\"severity\"");
    }
}
