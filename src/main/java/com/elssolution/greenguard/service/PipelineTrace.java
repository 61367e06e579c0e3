package com.elssolution.greenguard.service;

import com.elssolution.greenguard.domain.PipelineStage;
import com.elssolution.greenguard.domain.TraceEntry;
import com.elssolution.greenguard.domain.TraceLevel;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;

/**
 * Append-only trace for one pipeline run. Entries keep execution order and are mirrored
 * to the application log, tagged with the run's reading id.
 */
@Slf4j
public class PipelineTrace {

    private final List<TraceEntry> entries = new ArrayList<>();
    private final String runTag;
    private final Clock clock;

    public PipelineTrace(String runTag, Clock clock) {
        this.runTag = runTag;
        this.clock = clock;
    }

    public void info(PipelineStage stage, String message)    { add(stage, message, TraceLevel.INFO); }
    public void success(PipelineStage stage, String message) { add(stage, message, TraceLevel.SUCCESS); }
    public void warn(PipelineStage stage, String message)    { add(stage, message, TraceLevel.WARNING); }
    public void error(PipelineStage stage, String message)   { add(stage, message, TraceLevel.ERROR); }

    public synchronized void add(PipelineStage stage, String message, TraceLevel level) {
        entries.add(new TraceEntry(stage, message, level, clock.instant()));
        switch (level) {
            case WARNING -> log.warn("[{}] {}: {}", runTag, stage, message);
            case ERROR   -> log.error("[{}] {}: {}", runTag, stage, message);
            default      -> log.info("[{}] {}: {}", runTag, stage, message);
        }
    }

    public synchronized int size() {
        return entries.size();
    }

    public synchronized List<TraceEntry> entries() {
        return List.copyOf(entries);
    }

    /** Entries recorded at or after {@code mark} (a previous {@link #size()}). */
    public synchronized List<TraceEntry> since(int mark) {
        return List.copyOf(entries.subList(Math.min(mark, entries.size()), entries.size()));
    }
}
