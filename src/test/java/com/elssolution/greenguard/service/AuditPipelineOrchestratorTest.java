package com.elssolution.greenguard.service;

import com.elssolution.greenguard.alerts.AlertService;
import com.elssolution.greenguard.domain.*;
import com.elssolution.greenguard.integration.GridIntensityProvider;
import com.elssolution.greenguard.integration.TextCompletionProvider;
import com.elssolution.greenguard.integration.WeatherProvider;
import com.elssolution.greenguard.store.InMemoryAuditStore;
import com.elssolution.greenguard.store.InMemoryFacilityStore;
import com.elssolution.greenguard.store.InMemoryTelemetryStore;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Clock;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static com.elssolution.greenguard.service.Fixtures.NOON;
import static com.elssolution.greenguard.service.Fixtures.ahmedabad;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

class AuditPipelineOrchestratorTest {

    private InMemoryTelemetryStore telemetry;
    private InMemoryFacilityStore facilities;
    private InMemoryAuditStore audits;
    private TextCompletionProvider ai;
    private ReviewNotifier notifier;
    private AlertService alerts;
    private ExecutorService executor;
    private AuditPipelineOrchestrator orchestrator;

    @BeforeEach
    void setUp() {
        telemetry = new InMemoryTelemetryStore();
        facilities = new InMemoryFacilityStore();
        audits = new InMemoryAuditStore();
        facilities.save(ahmedabad());

        ai = mock(TextCompletionProvider.class);
        notifier = mock(ReviewNotifier.class);
        alerts = new AlertService();
        executor = Executors.newSingleThreadExecutor();

        // no live context: both providers report unconfigured
        ContextEnricher enricher = new ContextEnricher(mock(WeatherProvider.class), mock(GridIntensityProvider.class),
                new SyntheticContext(), 100, 100);
        AiClassifierAdapter adapter = new AiClassifierAdapter(ai, new AiPromptBuilder(), new AiResponseParser(),
                new FallbackClassifier(), 1_000);

        orchestrator = new AuditPipelineOrchestrator(telemetry, facilities, audits, enricher,
                new RuleClassifier(), new ContextualAnalyzer(), adapter, new VerdictReconciler(),
                notifier, alerts, executor, Clock.fixed(NOON, ZoneOffset.UTC), 10);
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    private String store(double energyKwh) {
        return telemetry.save(new TelemetryRecord(null, "ahmedabad-textiles", NOON, energyKwh,
                230, 12.5, 2875, Map.of())).id();
    }

    private void aiAnswers(String json) throws Exception {
        when(ai.isConfigured()).thenReturn(true);
        when(ai.complete(anyString(), any())).thenReturn(json);
    }

    private static List<String> messages(AuditVerdict v) {
        return v.getTrace().stream().map(TraceEntry::message).toList();
    }

    @Test
    void ai_cannot_downgrade_a_rule_anomaly() throws Exception {
        aiAnswers("{\"severity\":\"VERIFIED\",\"confidence\":95,\"reasoning\":\"Looks fine\"}");

        PipelineResult result = orchestrator.processReading(store(430));

        assertThat(result.severity()).isEqualTo(Severity.ANOMALY);
        assertThat(result.verdict().getConfidence()).isEqualTo(85);
        assertThat(result.verdict().getReasoning()).contains("22.9%");
        assertThat(messages(result.verdict())).anyMatch(m -> m.startsWith("Discarded AI_PRIMARY VERIFIED: Looks fine"));
    }

    @Test
    void ai_failure_falls_back_and_rule_floor_still_holds() throws Exception {
        when(ai.isConfigured()).thenReturn(true);
        when(ai.complete(anyString(), any())).thenThrow(new IOException("Gemini HTTP 503"));

        PipelineResult result = orchestrator.processReading(store(430));

        assertThat(result.severity()).isEqualTo(Severity.ANOMALY);
        assertThat(result.verdict().getTrace())
                .anyMatch(e -> e.stage() == PipelineStage.AI_CLASSIFIER
                        && e.level() == TraceLevel.WARNING
                        && e.message().contains("used local heuristic"));
    }

    @Test
    void ai_can_escalate_a_clean_rule_check() throws Exception {
        aiAnswers("{\"severity\":\"WARNING\",\"confidence\":66,\"reasoning\":\"Unusual for a cool day\"}");

        PipelineResult result = orchestrator.processReading(store(300));

        assertThat(result.severity()).isEqualTo(Severity.WARNING);
        assertThat(result.verdict().getConfidence()).isEqualTo(66);
        assertThat(result.verdict().getReasoning()).isEqualTo("Unusual for a cool day");
    }

    @Test
    void verified_reading_skips_notification() throws Exception {
        aiAnswers("{\"severity\":\"NORMAL\",\"confidence\":90,\"reasoning\":\"Typical\"}");

        PipelineResult result = orchestrator.processReading(store(200));

        assertThat(result.severity()).isEqualTo(Severity.VERIFIED);
        assertThat(result.finalState()).isEqualTo(PipelineState.PERSISTED);
        verifyNoInteractions(notifier);
        assertThat(alerts.isActive(AlertService.PIPELINE_FAILURE)).isFalse();
    }

    @Test
    void review_notification_moves_run_to_notified() throws Exception {
        aiAnswers("{\"severity\":\"WARNING\",\"confidence\":72,\"reasoning\":\"Above ceiling\"}");
        when(notifier.isEnabled()).thenReturn(true);
        when(notifier.notifyReviewRequired(any())).thenReturn(true);

        PipelineResult result = orchestrator.processReading(store(400));

        assertThat(result.finalState()).isEqualTo(PipelineState.NOTIFIED);
        verify(notifier).notifyReviewRequired(argThat(v -> v.getId().equals(result.auditId()) && v.requiresAction()));

        AuditVerdict stored = audits.findById(result.auditId()).orElseThrow();
        assertThat(stored.getTrace().get(stored.getTrace().size() - 1).stage()).isEqualTo(PipelineStage.NOTIFICATION);
    }

    @Test
    void failed_notification_leaves_run_persisted_with_trace() throws Exception {
        aiAnswers("{\"severity\":\"WARNING\",\"confidence\":60,\"reasoning\":\"Above ceiling\"}");
        when(notifier.isEnabled()).thenReturn(true);
        when(notifier.notifyReviewRequired(any())).thenThrow(new IllegalStateException("telegram down"));

        PipelineResult result = orchestrator.processReading(store(400));

        assertThat(result.finalState()).isEqualTo(PipelineState.PERSISTED);
        assertThat(messages(audits.findById(result.auditId()).orElseThrow()))
                .anyMatch(m -> m.contains("no notification delivered"));
    }

    @Test
    void states_and_provenance_are_traced_in_order() throws Exception {
        aiAnswers("{\"severity\":\"VERIFIED\",\"confidence\":80,\"reasoning\":\"ok\"}");

        PipelineResult result = orchestrator.processReading(store(250));

        List<String> states = messages(result.verdict()).stream().filter(m -> m.startsWith("State: ")).toList();
        assertThat(states).containsExactly("State: INGESTED", "State: ENRICHING", "State: RULE_CHECKED",
                "State: AI_CLASSIFIED", "State: RECONCILED", "State: PERSISTED");
        assertThat(messages(result.verdict()))
                .anyMatch(m -> m.startsWith("Weather:") && m.endsWith("[synthetic]"))
                .anyMatch(m -> m.startsWith("Grid carbon intensity:") && m.endsWith("[synthetic]"))
                .anyMatch(m -> m.startsWith("Historical average (last 1 readings): 250.0 kWh"));
    }

    @Test
    void missing_reading_still_persists_a_system_error_verdict() {
        PipelineResult result = orchestrator.processReading("does-not-exist");

        assertThat(result.severity()).isEqualTo(Severity.WARNING);
        assertThat(result.verdict().getConfidence()).isZero();
        assertThat(result.verdict().getReasoning()).isEqualTo(AuditPipelineOrchestrator.SYSTEM_ERROR_REASONING);
        assertThat(audits.findAll()).hasSize(1);
        assertThat(result.verdict().getTrace()).anyMatch(e -> e.level() == TraceLevel.ERROR);
        assertThat(alerts.isActive(AlertService.PIPELINE_FAILURE)).isTrue();
    }

    @Test
    void invalid_rules_end_in_system_error_without_calling_ai() throws Exception {
        facilities.save(ahmedabad().toBuilder().maxLoadKwh(0).build());

        PipelineResult result = orchestrator.processReading(store(100));

        assertThat(result.verdict().getReasoning()).isEqualTo(AuditPipelineOrchestrator.SYSTEM_ERROR_REASONING);
        assertThat(result.finalState()).isEqualTo(PipelineState.PERSISTED);
        verify(ai, never()).complete(anyString(), any());
    }

    @Test
    void success_after_failure_resolves_pipeline_alert() throws Exception {
        orchestrator.processReading("missing");
        assertThat(alerts.isActive(AlertService.PIPELINE_FAILURE)).isTrue();

        orchestrator.processReading(store(200));

        assertThat(alerts.isActive(AlertService.PIPELINE_FAILURE)).isFalse();
    }

    @Test
    void interrupted_run_is_persisted_and_keeps_interrupt() {
        String id = store(200);

        Thread.currentThread().interrupt();
        PipelineResult result;
        try {
            result = orchestrator.processReading(id);
        } finally {
            assertThat(Thread.interrupted()).isTrue();
        }

        assertThat(result.verdict().getReasoning()).isEqualTo(AuditPipelineOrchestrator.SYSTEM_ERROR_REASONING);
        assertThat(messages(result.verdict())).anyMatch(m -> m.contains("PipelineCancelledException"));
        assertThat(audits.findAll()).hasSize(1);
    }

    @Test
    void submit_runs_on_the_pipeline_pool() throws Exception {
        aiAnswers("{\"severity\":\"VERIFIED\",\"confidence\":80,\"reasoning\":\"ok\"}");

        PipelineResult result = orchestrator.submit(store(200)).get(5, TimeUnit.SECONDS);

        assertThat(audits.findById(result.auditId())).isPresent();
    }
}
