package com.elssolution.greenguard.config;

import com.elssolution.greenguard.alerts.GlobalUncaughtHandler;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.annotation.SchedulingConfigurer;
import org.springframework.scheduling.config.ScheduledTaskRegistrar;

import java.time.Clock;
import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicInteger;

@Slf4j
@Configuration
@EnableScheduling
public class SchedulingConfig implements SchedulingConfigurer {
    private final GlobalUncaughtHandler handler;

    public SchedulingConfig(GlobalUncaughtHandler handler) {
        this.handler = handler;
    }

    @Bean(destroyMethod = "shutdown")
    public ScheduledExecutorService scheduler() {
        ScheduledThreadPoolExecutor ex = new ScheduledThreadPoolExecutor(1, r -> {
            Thread t = new Thread(r);
            t.setName("audit-sched-" + t.getId());
            t.setDaemon(true);
            t.setUncaughtExceptionHandler(handler);
            return t;
        });
        ex.setRemoveOnCancelPolicy(true);
        ex.setContinueExistingPeriodicTasksAfterShutdownPolicy(false);
        ex.setExecuteExistingDelayedTasksAfterShutdownPolicy(false);
        return ex;
    }

    /** Worker pool for audit runs. Runs are independent; pool size caps concurrent provider calls. */
    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService pipelineExecutor(@Value("${audit.pipeline.threads:4}") int threads) {
        AtomicInteger seq = new AtomicInteger();
        int size = Math.max(1, threads);
        log.info("Audit pipeline pool: {} threads", size);
        return Executors.newFixedThreadPool(size, r -> {
            Thread t = new Thread(r);
            t.setName("audit-pipeline-" + seq.incrementAndGet());
            t.setDaemon(true);
            t.setUncaughtExceptionHandler(handler);
            return t;
        });
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Override
    public void configureTasks(ScheduledTaskRegistrar taskRegistrar) {
        taskRegistrar.setScheduler(scheduler());
    }
}
