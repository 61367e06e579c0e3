package com.elssolution.greenguard.domain;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.Instant;
import java.util.List;

/**
 * Final, persisted outcome for one reading. Only {@code humanAction} (with its timestamp)
 * changes after creation.
 */
@Value
@Builder(toBuilder = true)
public class AuditVerdict {
    String id;
    String telemetryId;
    Severity severity;
    int confidence;
    String reasoning;
    @Singular("traceEntry")
    List<TraceEntry> trace;
    HumanAction humanAction;
    Instant humanActionAt;
    Instant createdAt;

    public boolean isPendingReview() {
        return humanAction == null && severity != null && severity.needsReview();
    }

    /** ANOMALY always; WARNING only when the classifier was fairly sure. */
    public boolean requiresAction() {
        return severity == Severity.ANOMALY || (severity == Severity.WARNING && confidence > 70);
    }
}
