package com.foundryrelay.common.infra;

import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Runs an action on a fixed delay on its own daemon thread.
 * A failing run is logged and does not stop later runs.
 */
@Slf4j
public class IntervalRunner implements AutoCloseable {

    private final String name;
    private final long intervalMs;
    private final Runnable action;
    private final ScheduledExecutorService scheduler;
    private final AtomicBoolean running = new AtomicBoolean(false);
    private volatile ScheduledFuture<?> scheduledTask;

    /**
     * @param name       thread name, also used in log lines
     * @param intervalMs delay between the end of one run and the start of the next
     * @param action     work to run
     */
    public IntervalRunner(String name, long intervalMs, Runnable action) {
        if (intervalMs <= 0) {
            throw new IllegalArgumentException("intervalMs must be positive: " + intervalMs);
        }
        this.name = name;
        this.intervalMs = intervalMs;
        this.action = action;
        this.scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, name);
            t.setDaemon(true);
            return t;
        });
    }

    public void start() {
        if (!running.compareAndSet(false, true)) {
            log.debug("{} already running", name);
            return;
        }
        scheduledTask = scheduler.scheduleWithFixedDelay(this::runOnce,
                intervalMs, intervalMs, TimeUnit.MILLISECONDS);
        log.info("{} started (interval: {}ms)", name, intervalMs);
    }

    public void stop() {
        if (!running.compareAndSet(true, false)) {
            return;
        }
        ScheduledFuture<?> task = scheduledTask;
        if (task != null) {
            task.cancel(false);
        }
        log.info("{} stopped", name);
    }

    /**
     * Run the action now, outside the normal schedule.
     */
    public void triggerNow() {
        scheduler.execute(this::runOnce);
    }

    public boolean isRunning() {
        return running.get();
    }

    public long getIntervalMs() {
        return intervalMs;
    }

    private void runOnce() {
        try {
            action.run();
        } catch (Exception e) {
            log.error("{} run failed: {}", name, e.getMessage(), e);
        }
    }

    @Override
    public void close() {
        stop();
        scheduler.shutdown();
        try {
            if (!scheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                scheduler.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            scheduler.shutdownNow();
        }
    }
}
