package com.redsched.beat;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.SmartLifecycle;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Host loop: runs {@link BeatScheduler#tick()} on a single thread and sleeps for whatever
 * the tick returns. Static entries are installed before the first tick, and again on later
 * ticks until that succeeds.
 */
@Component
@ConditionalOnProperty(name = "redsched.beat.enabled", havingValue = "true", matchIfMissing = true)
public class BeatService implements SmartLifecycle {

    private static final Logger log = LoggerFactory.getLogger(BeatService.class);

    private final BeatScheduler scheduler;
    private final StaticScheduleLoader staticLoader;

    private ScheduledExecutorService executor;
    private volatile boolean running;
    private volatile boolean staticsInstalled;

    public BeatService(BeatScheduler scheduler, StaticScheduleLoader staticLoader) {
        this.scheduler = scheduler;
        this.staticLoader = staticLoader;
    }

    @Override
    public synchronized void start() {
        if (running) return;
        executor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread thread = new Thread(r, "redsched-beat");
            thread.setDaemon(true);
            return thread;
        });
        running = true;
        log.info("beat: Starting... (max interval {})", scheduler.getMaxInterval());
        schedule(Duration.ZERO);
    }

    @Override
    public synchronized void stop() {
        if (!running) return;
        running = false;
        executor.shutdownNow();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                log.warn("beat: tick thread did not stop within 5s");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        log.info("beat: Shutting down");
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    void runOnce() {
        if (!running) return;
        installStatics();

        Duration sleep;
        try {
            sleep = scheduler.tick();
        } catch (RuntimeException e) {
            log.error("beat: tick failed", e);
            sleep = scheduler.getMaxInterval();
        }
        log.debug("beat: Waking up in {}", sleep);
        schedule(sleep);
    }

    boolean isStaticsInstalled() {
        return staticsInstalled;
    }

    private void installStatics() {
        if (staticsInstalled) return;
        try {
            staticLoader.setupSchedule();
            staticsInstalled = true;
        } catch (RuntimeException e) {
            log.error("beat: could not install static entries, retrying next tick: {}", e.getMessage());
        }
    }

    private void schedule(Duration delay) {
        if (!running) return;
        try {
            executor.schedule(this::runOnce, delay.toMillis(), TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            log.debug("beat: executor shut down, not scheduling next tick");
        }
    }
}
