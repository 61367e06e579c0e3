package com.elssolution.greenguard.domain;

/** Reviewer decision on a persisted verdict. Set at most once. */
public enum HumanAction {
    APPROVED,
    FLAGGED
}
