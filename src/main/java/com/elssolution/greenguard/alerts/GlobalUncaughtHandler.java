package com.elssolution.greenguard.alerts;

import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.ContextClosedEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * Last-resort handler for scheduler threads. Pipeline runs go through
 * {@code ExecutorService.submit}, so their failures stay in the returned future
 * and surface as {@link AlertService#PIPELINE_FAILURE} instead.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class GlobalUncaughtHandler implements Thread.UncaughtExceptionHandler {

    static final String UNCAUGHT = "UNCAUGHT";

    private final AlertService alerts;

    private volatile boolean stopping = false; // mute noise while shutting down

    @PostConstruct
    void registerAsDefault() {
        Thread.setDefaultUncaughtExceptionHandler(this);
        log.info("Global uncaught handler installed");
    }

    @EventListener
    public void onContextClosed(ContextClosedEvent e) {
        stopping = true;
    }

    @Override
    public void uncaughtException(Thread t, Throwable e) {
        if (stopping) return;

        log.error("Uncaught in {} -> {}", t.getName(), e.toString(), e);
        alerts.raise(UNCAUGHT, t.getName() + ": " + e, AlertService.Severity.CRITICAL);
    }
}
