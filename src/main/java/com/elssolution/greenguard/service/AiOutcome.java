package com.elssolution.greenguard.service;

import com.elssolution.greenguard.domain.ClassifierVerdict;
import com.elssolution.greenguard.domain.VerdictSource;

/** AI stage result. {@code fallbackReason} is null on the primary path. */
public record AiOutcome(ClassifierVerdict verdict, String fallbackReason) {

    public static AiOutcome primary(ClassifierVerdict verdict) {
        return new AiOutcome(verdict, null);
    }

    public static AiOutcome fallback(ClassifierVerdict verdict, String reason) {
        return new AiOutcome(verdict, reason);
    }

    public boolean usedFallback() {
        return verdict.source() == VerdictSource.AI_FALLBACK;
    }
}
