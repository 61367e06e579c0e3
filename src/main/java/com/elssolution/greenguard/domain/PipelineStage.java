package com.elssolution.greenguard.domain;

/** Trace author. */
public enum PipelineStage {
    SYSTEM,
    INGESTION,
    CONTEXT,
    RULES,
    CONTEXT_ANALYSIS,
    AI_CLASSIFIER,
    RECONCILER,
    PERSISTENCE,
    NOTIFICATION
}
