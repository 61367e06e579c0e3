package com.elssolution.greenguard.domain;

import java.util.List;

/** Suspicion flags derived from reading + context. Feeds the trace and the AI prompt, never severity. */
public record ContextualAnalysis(boolean suspicious, String reasoning, List<String> flags) {
    public ContextualAnalysis {
        flags = flags == null ? List.of() : List.copyOf(flags);
    }
}
