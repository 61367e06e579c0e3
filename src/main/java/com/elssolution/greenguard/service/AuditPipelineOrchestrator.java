package com.elssolution.greenguard.service;

import com.elssolution.greenguard.alerts.AlertService;
import com.elssolution.greenguard.domain.*;
import com.elssolution.greenguard.store.AuditStore;
import com.elssolution.greenguard.store.FacilityStore;
import com.elssolution.greenguard.store.TelemetryStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;

/**
 * Runs one reading through enrich → rules + context → AI → reconcile → persist → notify.
 * <p>
 * Every run ends with exactly one persisted verdict. Any failure before persistence is turned
 * into a WARNING system-error verdict so the reading still lands in the review queue.
 * Runs share no mutable state; concurrency comes from {@link #submit(String)}.
 */
@Slf4j
@Service
public class AuditPipelineOrchestrator {

    static final String SYSTEM_ERROR_REASONING = "system error — manual review required";

    private final TelemetryStore telemetry;
    private final FacilityStore facilities;
    private final AuditStore audits;
    private final ContextEnricher enricher;
    private final RuleClassifier ruleClassifier;
    private final ContextualAnalyzer contextualAnalyzer;
    private final AiClassifierAdapter aiClassifier;
    private final VerdictReconciler reconciler;
    private final ReviewNotifier notifier;
    private final AlertService alerts;
    private final ExecutorService pipelineExecutor;
    private final Clock clock;
    private final int historyWindow;

    public AuditPipelineOrchestrator(TelemetryStore telemetry,
                                     FacilityStore facilities,
                                     AuditStore audits,
                                     ContextEnricher enricher,
                                     RuleClassifier ruleClassifier,
                                     ContextualAnalyzer contextualAnalyzer,
                                     AiClassifierAdapter aiClassifier,
                                     VerdictReconciler reconciler,
                                     ReviewNotifier notifier,
                                     AlertService alerts,
                                     @Qualifier("pipelineExecutor") ExecutorService pipelineExecutor,
                                     Clock clock,
                                     @Value("${audit.history.window:10}") int historyWindow) {
        this.telemetry = telemetry;
        this.facilities = facilities;
        this.audits = audits;
        this.enricher = enricher;
        this.ruleClassifier = ruleClassifier;
        this.contextualAnalyzer = contextualAnalyzer;
        this.aiClassifier = aiClassifier;
        this.reconciler = reconciler;
        this.notifier = notifier;
        this.alerts = alerts;
        this.pipelineExecutor = pipelineExecutor;
        this.clock = clock;
        this.historyWindow = Math.max(1, historyWindow);
    }

    /** Queues a run on the pipeline pool. Cancelling the future interrupts the run. */
    public Future<PipelineResult> submit(String telemetryId) {
        return pipelineExecutor.submit(() -> processReading(telemetryId));
    }

    public PipelineResult processReading(String telemetryId) {
        PipelineTrace trace = new PipelineTrace(shortId(telemetryId), clock);
        Run run = new Run(trace);
        trace.info(PipelineStage.SYSTEM, "Audit pipeline initiated for reading " + shortId(telemetryId));
        run.moveTo(PipelineState.INGESTED);

        AuditVerdict draft;
        boolean failed = false;
        boolean cancelled = false;
        try {
            draft = runStages(telemetryId, run);
        } catch (PipelineCancelledException e) {
            cancelled = true;
            Thread.interrupted(); // clear so persistence can finish
            draft = systemError(telemetryId, trace, e);
            failed = true;
        } catch (Exception e) {
            log.error("pipeline_failed telemetryId={} err={}", telemetryId, e.toString(), e);
            draft = systemError(telemetryId, trace, e);
            failed = true;
        }

        try {
            PipelineResult result = persistAndNotify(draft, run);
            if (!failed) alerts.resolve(AlertService.PIPELINE_FAILURE);
            return result;
        } catch (RuntimeException e) {
            log.error("audit_persist_failed telemetryId={} err={}", telemetryId, e.toString(), e);
            alerts.raise(AlertService.PIPELINE_FAILURE,
                    "Could not persist audit for reading " + telemetryId + ": " + e.getMessage(),
                    AlertService.Severity.CRITICAL);
            throw e;
        } finally {
            if (cancelled) Thread.currentThread().interrupt();
        }
    }

    private AuditVerdict runStages(String telemetryId, Run run) {
        PipelineTrace trace = run.trace;

        TelemetryRecord reading = telemetry.findById(telemetryId)
                .orElseThrow(() -> new IllegalStateException("Telemetry record not found: " + telemetryId));
        trace.success(PipelineStage.INGESTION, String.format(Locale.ROOT,
                "Received reading: %.1f kWh at %s (V=%.1f, I=%.1f A, P=%.1f W)",
                reading.energyKwh(), reading.timestamp(), reading.voltage(), reading.currentAmps(), reading.powerWatts()));

        FacilityRules rules = facilities.findById(reading.facilityId())
                .orElseThrow(() -> new UnknownFacilityException(reading.facilityId()))
                .requireValid();
        trace.info(PipelineStage.INGESTION, String.format(Locale.ROOT,
                "Facility: %s | max load %.1f kWh | baseline %.0f g/kWh",
                rules.getName(), rules.getMaxLoadKwh(), rules.getBaselineCarbonIntensity()));

        double historicalAvg = historicalAverage(reading, trace);
        checkCancelled("before enrichment");

        // enrich
        run.moveTo(PipelineState.ENRICHING);
        GeoLocation location = rules.locationOrUnknown();
        trace.info(PipelineStage.CONTEXT, "Fetching context for " + location.name());
        ContextSnapshot ctx = enricher.enrich(location, reading.timestamp());
        traceContext(ctx, trace);
        checkCancelled("after enrichment");

        // rules + context
        ClassifierVerdict ruleVerdict = ruleClassifier.classify(reading, rules);
        trace.add(PipelineStage.RULES, "Rule verdict: " + ruleVerdict.severity()
                + " (" + ruleVerdict.confidence() + "%) " + ruleVerdict.reasoning(), levelFor(ruleVerdict.severity()));

        ContextualAnalysis analysis = contextualAnalyzer.analyze(reading, ctx, rules);
        trace.add(PipelineStage.CONTEXT_ANALYSIS,
                (analysis.suspicious() ? "Suspicious: " : "Context check: ") + analysis.reasoning()
                        + (analysis.flags().isEmpty() ? "" : " " + analysis.flags()),
                analysis.suspicious() ? TraceLevel.WARNING : TraceLevel.INFO);
        run.moveTo(PipelineState.RULE_CHECKED);

        // ai
        trace.info(PipelineStage.AI_CLASSIFIER, "Invoking AI classifier");
        AiOutcome ai = aiClassifier.classify(new ClassificationInput(reading, ctx, rules, analysis, historicalAvg));
        if (ai.usedFallback()) {
            trace.warn(PipelineStage.AI_CLASSIFIER, "AI unavailable (" + ai.fallbackReason() + "), used local heuristic");
        } else {
            trace.info(PipelineStage.AI_CLASSIFIER, "AI provider answered (primary path)");
        }
        trace.success(PipelineStage.AI_CLASSIFIER, "AI verdict: " + ai.verdict().severity()
                + " (" + ai.verdict().confidence() + "%) " + ai.verdict().reasoning());
        checkCancelled("after AI classification");
        run.moveTo(PipelineState.AI_CLASSIFIED);

        // reconcile
        Reconciliation rec = reconciler.reconcile(ruleVerdict, ai.verdict());
        trace.info(PipelineStage.RECONCILER, "Final verdict: " + rec.severity() + " (" + rec.confidence()
                + "%) from " + rec.chosen().source());
        trace.info(PipelineStage.RECONCILER, "Discarded " + rec.discarded().source() + " "
                + rec.discarded().severity() + ": " + rec.discarded().reasoning());
        if (analysis.suspicious()) {
            trace.info(PipelineStage.RECONCILER, "Contextual note: " + analysis.reasoning());
        }
        run.moveTo(PipelineState.RECONCILED);

        return AuditVerdict.builder()
                .telemetryId(telemetryId)
                .severity(rec.severity())
                .confidence(rec.confidence())
                .reasoning(rec.reasoning())
                .build();
    }

    private PipelineResult persistAndNotify(AuditVerdict draft, Run run) {
        PipelineTrace trace = run.trace;
        trace.info(PipelineStage.PERSISTENCE, "Creating audit verdict");

        AuditVerdict toStore = draft.toBuilder()
                .createdAt(clock.instant())
                .trace(trace.entries())
                .build();
        String auditId = audits.createAuditVerdict(toStore);
        int mark = trace.size();
        trace.success(PipelineStage.PERSISTENCE, "Audit verdict created: " + shortId(auditId));
        run.moveTo(PipelineState.PERSISTED);

        AuditVerdict stored = toStore.toBuilder().id(auditId).build();
        if (stored.getSeverity().needsReview()) {
            if (deliver(stored)) {
                run.moveTo(PipelineState.NOTIFIED);
                trace.warn(PipelineStage.NOTIFICATION, "Review requested: " + stored.getSeverity()
                        + (stored.requiresAction() ? " (action required)" : ""));
            } else {
                trace.warn(PipelineStage.NOTIFICATION, "Audit requires human review (" + stored.getSeverity()
                        + "); no notification delivered");
            }
        } else {
            trace.success(PipelineStage.SYSTEM, "Audit complete: VERIFIED, no action required");
        }

        audits.appendTrace(auditId, trace.since(mark));
        AuditVerdict finalVerdict = audits.findById(auditId).orElse(stored);
        log.info("audit_done telemetryId={} auditId={} severity={} confidence={} state={}",
                draft.getTelemetryId(), auditId, finalVerdict.getSeverity(), finalVerdict.getConfidence(), run.state);
        return new PipelineResult(auditId, finalVerdict, run.state);
    }

    private boolean deliver(AuditVerdict verdict) {
        if (!notifier.isEnabled()) return false;
        try {
            return notifier.notifyReviewRequired(verdict);
        } catch (RuntimeException e) {
            log.warn("review_notify_failed auditId={} err={}", verdict.getId(), e.toString());
            return false;
        }
    }

    private AuditVerdict systemError(String telemetryId, PipelineTrace trace, Exception e) {
        trace.error(PipelineStage.SYSTEM, "Pipeline failed: " + e.getClass().getSimpleName()
                + (e.getMessage() == null ? "" : ": " + e.getMessage()));
        alerts.raise(AlertService.PIPELINE_FAILURE,
                "Audit of reading " + telemetryId + " failed: " + e.getMessage(), AlertService.Severity.ERROR);
        return AuditVerdict.builder()
                .telemetryId(telemetryId)
                .severity(Severity.WARNING)
                .confidence(0)
                .reasoning(SYSTEM_ERROR_REASONING)
                .build();
    }

    /** Mean of the facility's latest readings, current one included. */
    private double historicalAverage(TelemetryRecord reading, PipelineTrace trace) {
        List<TelemetryRecord> recent = telemetry.findRecentByFacility(reading.facilityId(), historyWindow);
        if (recent.isEmpty()) {
            trace.warn(PipelineStage.CONTEXT, "No historical data, using current reading as baseline");
            return reading.energyKwh();
        }
        double avg = recent.stream().mapToDouble(TelemetryRecord::energyKwh).average().orElse(reading.energyKwh());
        trace.info(PipelineStage.CONTEXT, String.format(Locale.ROOT,
                "Historical average (last %d readings): %.1f kWh", recent.size(), avg));
        return avg;
    }

    private static void traceContext(ContextSnapshot ctx, PipelineTrace trace) {
        for (String reason : ctx.fallbackReasons()) {
            trace.warn(PipelineStage.CONTEXT, "Fallback: " + reason);
        }
        trace.add(PipelineStage.CONTEXT, String.format(Locale.ROOT,
                        "Weather: %.1f°C, %s, humidity %d%% [%s]",
                        ctx.temperatureC(), ctx.weatherCondition(), ctx.humidityPct(),
                        ctx.sourceProvenance().weather().label()),
                ctx.sourceProvenance().weather() == Provenance.API ? TraceLevel.SUCCESS : TraceLevel.INFO);
        trace.add(PipelineStage.CONTEXT, String.format(Locale.ROOT,
                        "Grid carbon intensity: %.0f g/kWh%s [%s]",
                        ctx.gridCarbonIntensity(), ctx.isHighIntensity() ? " (high)" : "",
                        ctx.sourceProvenance().grid().label()),
                ctx.sourceProvenance().grid() == Provenance.API ? TraceLevel.SUCCESS : TraceLevel.INFO);
    }

    private static TraceLevel levelFor(Severity s) {
        return switch (s) {
            case ANOMALY -> TraceLevel.ERROR;
            case WARNING -> TraceLevel.WARNING;
            case VERIFIED -> TraceLevel.SUCCESS;
        };
    }

    private static void checkCancelled(String where) {
        if (Thread.currentThread().isInterrupted()) {
            throw new PipelineCancelledException("Audit run cancelled " + where);
        }
    }

    private static String shortId(String id) {
        if (id == null) return "null";
        return id.length() <= 8 ? id : id.substring(0, 8);
    }

    /** Forward-only state holder for one run. */
    private static final class Run {
        final PipelineTrace trace;
        PipelineState state;

        Run(PipelineTrace trace) {
            this.trace = trace;
        }

        void moveTo(PipelineState next) {
            if (state != null && next.ordinal() <= state.ordinal()) {
                throw new IllegalStateException("Illegal transition " + state + " -> " + next);
            }
            state = next;
            trace.info(PipelineStage.SYSTEM, "State: " + next);
        }
    }
}
