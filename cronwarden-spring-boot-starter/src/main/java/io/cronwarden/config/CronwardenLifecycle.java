package io.cronwarden.config;

import io.cronwarden.Scheduler;
import org.springframework.context.SmartLifecycle;

/**
 * Bridges the scheduler's start/stop lifecycle with the Spring container lifecycle.
 */
public class CronwardenLifecycle implements SmartLifecycle {
    private final Scheduler scheduler;
    private final boolean autoStartup;
    private volatile boolean running = false;

    public CronwardenLifecycle(Scheduler scheduler, boolean autoStartup) {
        this.scheduler = scheduler;
        this.autoStartup = autoStartup;
    }

    @Override
    public void start() {
        scheduler.start();
        running = true;
    }

    @Override
    public void stop() {
        scheduler.stop();
        running = false;
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    @Override
    public int getPhase() {
        return Integer.MAX_VALUE;
    }

    @Override
    public boolean isAutoStartup() {
        return autoStartup;
    }
}
