/**
 * In-process registry and runner for recurring background jobs
 *
 * @author William Callahan
 *
 * Features:
 * - Registers named jobs against 5-field cron schedules
 * - Skips a firing when the previous run of the same job is still in flight
 * - Keeps per-job history (last success, last error, success count) across stop/start
 * - Supports manual runs, startup runs and enabling or disabling jobs at runtime
 * - Every cron firing runs inside its own error boundary
 */

package com.williamcallahan.media_list_sync.scheduler;

import com.williamcallahan.media_list_sync.exception.JobNotFoundException;
import com.williamcallahan.media_list_sync.monitoring.MetricsService;
import com.williamcallahan.media_list_sync.util.LoggingUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;

import java.time.Clock;
import java.time.Duration;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

public class JobScheduler {

    private static final Logger logger = LoggerFactory.getLogger(JobScheduler.class);

    private final Map<String, Job> jobs = new ConcurrentHashMap<>();
    private final JobTriggerSource triggerSource;
    private final Scheduler startupScheduler;
    private final MetricsService metricsService;
    private final Clock clock;

    private volatile boolean started;

    /**
     * @param triggerSource binds cron schedules to firings
     * @param startupScheduler runs {@code runOnStart} jobs off the caller's thread
     */
    public JobScheduler(JobTriggerSource triggerSource,
                        Scheduler startupScheduler,
                        MetricsService metricsService,
                        Clock clock) {
        this.triggerSource = triggerSource;
        this.startupScheduler = startupScheduler;
        this.metricsService = metricsService;
        this.clock = clock;
    }

    public void register(String name, String schedule, JobHandler handler) {
        register(name, schedule, handler, JobOptions.DEFAULTS);
    }

    /**
     * Adds a job to the registry. A second registration under the same name is ignored with a warning.
     *
     * @throws com.williamcallahan.media_list_sync.exception.ConfigurationException if {@code schedule}
     *         is not a valid cron expression
     */
    public synchronized void register(String name, String schedule, JobHandler handler, JobOptions options) {
        if (jobs.containsKey(name)) {
            logger.warn("Job {} already registered, skipping", name);
            return;
        }
        triggerSource.validate(schedule);
        Job job = new Job(name, schedule, handler, options != null ? options : JobOptions.DEFAULTS);
        jobs.put(name, job);
        logger.info("Registered job: {} ({}){}", name, schedule, job.isEnabled() ? "" : " [disabled]");

        // Late registrations join a running scheduler instead of waiting for the next start()
        if (started && job.isEnabled()) {
            bindTrigger(job);
        }
    }

    /**
     * Binds triggers for all enabled jobs and dispatches {@code runOnStart} jobs. No-op when already started.
     */
    public synchronized void start() {
        if (started) {
            logger.info("Job scheduler already started");
            return;
        }
        started = true;
        logger.info("Starting job scheduler with {} registered job(s)", jobs.size());

        for (Job job : jobs.values()) {
            if (!job.isEnabled()) {
                logger.info("Job {} is disabled, not scheduling", job.name());
                continue;
            }
            bindTrigger(job);
            if (job.runOnStart()) {
                logger.info("Running job {} on startup", job.name());
                startupScheduler.schedule(() -> fire(job.name(), RunTrigger.STARTUP));
            }
        }
    }

    /**
     * Cancels all live triggers. In-flight runs complete on their own and history is preserved.
     */
    public synchronized void stop() {
        if (!started) {
            return;
        }
        logger.info("Stopping job scheduler");
        for (Job job : jobs.values()) {
            ScheduledTrigger trigger = job.trigger();
            if (trigger != null) {
                trigger.stop();
                job.setTrigger(null);
            }
        }
        started = false;
    }

    /**
     * Runs a job immediately. Completes empty without invoking the handler when the job is already
     * running; fails with {@link JobNotFoundException} when no job has that name.
     */
    public Mono<Object> runJob(String name) {
        return runJob(name, RunTrigger.MANUAL);
    }

    Mono<Object> runJob(String name, RunTrigger trigger) {
        return Mono.defer(() -> {
            Job job = jobs.get(name);
            if (job == null) {
                return Mono.error(new JobNotFoundException(name));
            }
            if (!job.tryAcquire()) {
                logger.warn("Job {} is already running, skipping", name);
                metricsService.recordJobRun(name, MetricsService.OUTCOME_SKIPPED);
                return Mono.empty();
            }

            long startNanos = System.nanoTime();
            JobContext context = new JobContext(name, trigger, clock.instant());
            logger.info("Running job: {} ({})", name, trigger);

            return Mono.<Object>defer(() -> job.handler().execute(context))
                .doOnSuccess(result -> {
                    job.recordSuccess(clock.instant());
                    Duration elapsed = Duration.ofNanos(System.nanoTime() - startNanos);
                    metricsService.recordJobRun(name, MetricsService.OUTCOME_SUCCESS);
                    metricsService.recordJobDuration(name, elapsed);
                    logger.info("Job {} completed in {}s", name, String.format("%.2f", elapsed.toMillis() / 1000.0));
                })
                .doOnError(error -> {
                    job.recordFailure(LoggingUtils.rootMessage(error));
                    metricsService.recordJobRun(name, MetricsService.OUTCOME_FAILURE);
                    LoggingUtils.error(logger, error, "Job {} failed", name);
                })
                .doOnCancel(job::release);
        });
    }

    public List<JobStatusSnapshot> getStatus() {
        return jobs.values().stream()
            .map(Job::snapshot)
            .sorted(Comparator.comparing(JobStatusSnapshot::name))
            .toList();
    }

    /**
     * Flips a job's enabled flag. A job that had no trigger yet gets one when the scheduler is started.
     */
    public synchronized void setEnabled(String name, boolean enabled) {
        Job job = jobs.get(name);
        if (job == null) {
            throw new JobNotFoundException(name);
        }
        job.setEnabled(enabled);

        ScheduledTrigger trigger = job.trigger();
        if (trigger != null) {
            if (enabled) {
                trigger.start();
            } else {
                trigger.stop();
            }
        } else if (enabled && started) {
            bindTrigger(job);
        }
        logger.info("Job {} {}", name, enabled ? "enabled" : "disabled");
    }

    public boolean isStarted() {
        return started;
    }

    private void bindTrigger(Job job) {
        job.setTrigger(triggerSource.bind(job.name(), job.schedule(), () -> fire(job.name(), RunTrigger.CRON)));
        logger.info("Scheduled job: {} ({})", job.name(), job.schedule());
    }

    /**
     * Error boundary around a single firing; nothing thrown here may reach the trigger thread.
     */
    private void fire(String name, RunTrigger trigger) {
        Job job = jobs.get(name);
        if (job == null || !job.isEnabled()) {
            return;
        }
        try {
            runJob(name, trigger).subscribe(
                result -> { },
                error -> logger.debug("Firing of job {} ended with error: {}", name, error.getMessage()));
        } catch (RuntimeException e) {
            LoggingUtils.error(logger, e, "Unexpected error firing job {}", name);
        }
    }
}
