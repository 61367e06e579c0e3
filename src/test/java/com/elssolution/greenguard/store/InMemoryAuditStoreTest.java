package com.elssolution.greenguard.store;

import com.elssolution.greenguard.domain.*;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.concurrent.*;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class InMemoryAuditStoreTest {

    private static final Instant T0 = Instant.parse("2025-03-14T12:00:00Z");

    private final InMemoryAuditStore store = new InMemoryAuditStore(Clock.fixed(T0, ZoneOffset.UTC));

    private String create(Severity severity) {
        return store.createAuditVerdict(AuditVerdict.builder()
                .telemetryId("t-1")
                .severity(severity)
                .confidence(70)
                .reasoning("r")
                .traceEntry(new TraceEntry(PipelineStage.SYSTEM, "start", TraceLevel.INFO, T0))
                .build());
    }

    @Test
    void human_action_is_set_exactly_once() {
        String id = create(Severity.WARNING);

        AuditVerdict reviewed = store.setHumanAction(id, HumanAction.FLAGGED);

        assertThat(reviewed.getHumanAction()).isEqualTo(HumanAction.FLAGGED);
        assertThat(reviewed.getHumanActionAt()).isEqualTo(T0);
        assertThat(reviewed.isPendingReview()).isFalse();
        assertThatThrownBy(() -> store.setHumanAction(id, HumanAction.APPROVED))
                .isInstanceOf(HumanActionAlreadySetException.class);
        assertThat(store.findById(id).orElseThrow().getHumanAction()).isEqualTo(HumanAction.FLAGGED);
    }

    @Test
    void concurrent_reviewers_only_one_wins() throws Exception {
        String id = create(Severity.ANOMALY);
        ExecutorService pool = Executors.newFixedThreadPool(8);
        CountDownLatch go = new CountDownLatch(1);
        List<Future<Boolean>> attempts = new java.util.ArrayList<>();
        for (int i = 0; i < 8; i++) {
            HumanAction action = i % 2 == 0 ? HumanAction.APPROVED : HumanAction.FLAGGED;
            attempts.add(pool.submit(() -> {
                go.await();
                try {
                    store.setHumanAction(id, action);
                    return true;
                } catch (HumanActionAlreadySetException e) {
                    return false;
                }
            }));
        }
        go.countDown();

        int wins = 0;
        for (Future<Boolean> f : attempts) if (f.get(5, TimeUnit.SECONDS)) wins++;
        pool.shutdownNow();

        assertThat(wins).isEqualTo(1);
    }

    @Test
    void unknown_id_is_reported() {
        assertThatThrownBy(() -> store.setHumanAction("nope", HumanAction.APPROVED))
                .isInstanceOf(AuditNotFoundException.class);
        assertThatThrownBy(() -> store.appendTrace("nope",
                List.of(new TraceEntry(PipelineStage.SYSTEM, "x", TraceLevel.INFO, T0))))
                .isInstanceOf(AuditNotFoundException.class);
        assertThat(store.findById("nope")).isEmpty();
    }

    @Test
    void appended_trace_keeps_order() {
        String id = create(Severity.VERIFIED);

        store.appendTrace(id, List.of(
                new TraceEntry(PipelineStage.NOTIFICATION, "second", TraceLevel.INFO, T0),
                new TraceEntry(PipelineStage.SYSTEM, "third", TraceLevel.SUCCESS, T0)));

        assertThat(store.findById(id).orElseThrow().getTrace())
                .extracting(TraceEntry::message)
                .containsExactly("start", "second", "third");
    }

    @Test
    void verified_verdicts_are_not_pending() {
        String verified = create(Severity.VERIFIED);
        String warning = create(Severity.WARNING);

        assertThat(store.findById(verified).orElseThrow().isPendingReview()).isFalse();
        assertThat(store.findById(warning).orElseThrow().isPendingReview()).isTrue();
        assertThat(store.findById(warning).orElseThrow().getCreatedAt()).isEqualTo(T0);
    }
}
