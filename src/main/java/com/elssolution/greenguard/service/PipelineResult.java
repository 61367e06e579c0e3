package com.elssolution.greenguard.service;

import com.elssolution.greenguard.domain.AuditVerdict;
import com.elssolution.greenguard.domain.PipelineState;
import com.elssolution.greenguard.domain.Severity;

/** What one pipeline run produced. The verdict's trace is the full run trace. */
public record PipelineResult(String auditId, AuditVerdict verdict, PipelineState finalState) {

    public Severity severity() {
        return verdict.getSeverity();
    }
}
