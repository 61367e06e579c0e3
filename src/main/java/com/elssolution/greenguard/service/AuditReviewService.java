package com.elssolution.greenguard.service;

import com.elssolution.greenguard.domain.AuditNotFoundException;
import com.elssolution.greenguard.domain.AuditVerdict;
import com.elssolution.greenguard.domain.HumanAction;
import com.elssolution.greenguard.domain.Severity;
import com.elssolution.greenguard.store.AuditStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/** Reviewer-facing side of the audit store. */
@Slf4j
@Service
@RequiredArgsConstructor
public class AuditReviewService {

    private final AuditStore audits;

    public AuditVerdict find(String auditId) {
        return audits.findById(auditId).orElseThrow(() -> new AuditNotFoundException(auditId));
    }

    public List<AuditVerdict> all() {
        return audits.findAll();
    }

    /** WARNING/ANOMALY verdicts without a decision, newest first. */
    public List<AuditVerdict> pendingReviews() {
        return audits.findAll().stream().filter(AuditVerdict::isPendingReview).toList();
    }

    public Map<Severity, Long> pendingCountBySeverity() {
        Map<Severity, Long> counts = new EnumMap<>(Severity.class);
        for (AuditVerdict v : pendingReviews()) counts.merge(v.getSeverity(), 1L, Long::sum);
        return counts;
    }

    public AuditVerdict recordHumanAction(String auditId, HumanAction action) {
        if (action == null) throw new IllegalArgumentException("action is required (APPROVED or FLAGGED)");
        AuditVerdict updated = audits.setHumanAction(auditId, action);
        log.info("human_action auditId={} action={} severity={}", auditId, action, updated.getSeverity());
        return updated;
    }
}
