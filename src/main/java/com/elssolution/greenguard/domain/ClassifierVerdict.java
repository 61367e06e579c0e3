package com.elssolution.greenguard.domain;

import java.util.Objects;

/** Output of one classifier stage. Confidence is kept in 0..100. */
public record ClassifierVerdict(
        Severity severity,
        int confidence,
        String reasoning,
        VerdictSource source
) {
    public ClassifierVerdict {
        Objects.requireNonNull(severity, "severity");
        Objects.requireNonNull(source, "source");
        confidence = (int) Maths.clamp(confidence, 0, 100);
        reasoning = reasoning == null ? "" : reasoning;
    }
}
