package com.williamcallahan.media_list_sync.scheduler;

import java.time.Instant;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Mutable registry entry for one job. History is only written by the run that holds the
 * running flag, so plain volatile fields are enough for readers.
 */
final class Job {

    private final String name;
    private final String schedule;
    private final JobHandler handler;
    private final boolean runOnStart;

    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicLong runCount = new AtomicLong();

    private volatile boolean enabled;
    private volatile ScheduledTrigger trigger;
    private volatile Instant lastRun;
    private volatile String lastError;

    Job(String name, String schedule, JobHandler handler, JobOptions options) {
        this.name = name;
        this.schedule = schedule;
        this.handler = handler;
        this.runOnStart = options.runOnStart();
        this.enabled = options.enabled();
    }

    String name() {
        return name;
    }

    String schedule() {
        return schedule;
    }

    JobHandler handler() {
        return handler;
    }

    boolean runOnStart() {
        return runOnStart;
    }

    boolean isEnabled() {
        return enabled;
    }

    void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    ScheduledTrigger trigger() {
        return trigger;
    }

    void setTrigger(ScheduledTrigger trigger) {
        this.trigger = trigger;
    }

    boolean isRunning() {
        return running.get();
    }

    /**
     * Claims the running flag; false when another run holds it.
     */
    boolean tryAcquire() {
        return running.compareAndSet(false, true);
    }

    void release() {
        running.set(false);
    }

    void recordSuccess(Instant completedAt) {
        lastRun = completedAt;
        lastError = null;
        runCount.incrementAndGet();
        release();
    }

    void recordFailure(String message) {
        lastError = message;
        release();
    }

    JobStatusSnapshot snapshot() {
        ScheduledTrigger current = trigger;
        Instant nextRun = current != null ? current.nextFireTime().orElse(null) : null;
        return new JobStatusSnapshot(name, schedule, enabled, running.get(), lastRun, lastError,
                runCount.get(), nextRun);
    }
}
