package io.postscheduler.config;

import io.postscheduler.PostScheduler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.SmartLifecycle;

import java.time.Duration;

/**
 * Bridges the scheduler loop with the Spring container lifecycle.
 *
 * <p>On shutdown the loop is signalled and given up to the agent timeout to finish the post it is
 * working on; an in-flight post is never interrupted.
 */
public class PostSchedulerLifecycle implements SmartLifecycle {
    private static final Logger log = LoggerFactory.getLogger(PostSchedulerLifecycle.class);

    private final PostScheduler scheduler;
    private final boolean autoStartup;
    private final Duration shutdownWait;
    private volatile boolean running = false;

    public PostSchedulerLifecycle(PostScheduler scheduler, boolean autoStartup, Duration shutdownWait) {
        this.scheduler = scheduler;
        this.autoStartup = autoStartup;
        this.shutdownWait = shutdownWait;
    }

    @Override
    public void start() {
        scheduler.start();
        running = true;
    }

    @Override
    public void stop() {
        scheduler.stop();
        try {
            if (!scheduler.awaitStopped(shutdownWait)) {
                log.warn("PostScheduler loop still busy after {}; leaving it to finish in the background", shutdownWait);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
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
