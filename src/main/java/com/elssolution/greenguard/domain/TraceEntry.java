package com.elssolution.greenguard.domain;

import java.time.Instant;

public record TraceEntry(PipelineStage stage, String message, TraceLevel level, Instant timestamp) {}
