package com.elssolution.greenguard.domain;

import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Audit risk of a reading, ordered by {@link #rank()}. Rank 1 is unused.
 */
public enum Severity {
    VERIFIED(0),
    WARNING(2),
    ANOMALY(3);

    private final int rank;

    Severity(int rank) { this.rank = rank; }

    public int rank() { return rank; }

    public boolean isHigherThan(Severity other) { return rank > other.rank; }

    /** True for verdicts a human has to look at. */
    public boolean needsReview() { return this != VERIFIED; }

    // Classifier labels seen in the wild → canonical severity. PENDING/REJECTED are reviewer states, not verdicts.
    private static final Map<String, Severity> LABELS = Map.of(
            "VERIFIED", VERIFIED,
            "NORMAL",   VERIFIED,
            "WARNING",  WARNING,
            "ANOMALY",  ANOMALY
    );

    /** Case-insensitive label lookup through the alias table; empty for anything else. */
    public static Optional<Severity> fromLabel(String label) {
        if (label == null || label.isBlank()) return Optional.empty();
        return Optional.ofNullable(LABELS.get(label.trim().toUpperCase(Locale.ROOT)));
    }

    public static Severity max(Severity a, Severity b) {
        return b.isHigherThan(a) ? b : a;
    }
}
