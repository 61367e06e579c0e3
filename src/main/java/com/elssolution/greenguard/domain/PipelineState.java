package com.elssolution.greenguard.domain;

/** Lifecycle of one reading through the audit pipeline. PERSISTED and NOTIFIED are terminal. */
public enum PipelineState {
    INGESTED,
    ENRICHING,
    RULE_CHECKED,
    AI_CLASSIFIED,
    RECONCILED,
    PERSISTED,
    NOTIFIED
}
