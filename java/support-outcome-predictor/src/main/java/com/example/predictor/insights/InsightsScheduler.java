package com.example.predictor.insights;

import java.util.concurrent.ScheduledFuture;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.SmartLifecycle;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;
import org.springframework.stereotype.Component;

import com.example.predictor.config.InsightsProperties;

/**
 * Recurring insight refresh on its own thread. The returned {@link ScheduledFuture} is the
 * cancellation handle; stopping the context cancels it and interrupts a running generation.
 */
@Component
public class InsightsScheduler implements SmartLifecycle {

    private static final Logger log = LoggerFactory.getLogger(InsightsScheduler.class);

    private final InsightsGenerator generator;
    private final InsightsProperties properties;
    private final ThreadPoolTaskScheduler taskScheduler;
    private volatile ScheduledFuture<?> task;

    public InsightsScheduler(InsightsGenerator generator, InsightsProperties properties) {
        this.generator = generator;
        this.properties = properties;
        this.taskScheduler = new ThreadPoolTaskScheduler();
        this.taskScheduler.setPoolSize(1);
        this.taskScheduler.setThreadNamePrefix("insights-");
        this.taskScheduler.setDaemon(true);
    }

    @Override
    public synchronized void start() {
        if (task != null) return;
        if (!properties.scheduleEnabled()) {
            log.info("Scheduled insight refresh disabled; explicit triggers only");
            return;
        }
        taskScheduler.initialize();
        task = taskScheduler.scheduleWithFixedDelay(this::tick, properties.refreshInterval());
        log.info("Insight refresh scheduled every {}s (min new predictions={})",
            properties.refreshInterval().toSeconds(), properties.minNewPredictions());
    }

    @Override
    public synchronized void stop() {
        if (task == null) return;
        task.cancel(true);
        task = null;
        taskScheduler.shutdown();
        log.info("Insight refresh stopped");
    }

    @Override
    public boolean isRunning() {
        return task != null;
    }

    void tick() {
        try {
            if (generator.refreshIfDue()) {
                log.debug("Scheduled insight refresh ran");
            }
        } catch (RuntimeException e) {
            // a failing tick must not cancel the recurring task
            log.error("Scheduled insight refresh failed: {}", e.getMessage(), e);
        }
    }
}
