package com.elssolution.greenguard.domain;

/** Which stage produced a {@link ClassifierVerdict}. */
public enum VerdictSource {
    RULE_ENGINE,
    AI_PRIMARY,
    AI_FALLBACK,
    SYSTEM
}
