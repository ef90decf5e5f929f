/**
 * Registers job beans with the scheduler once the application is ready
 *
 * @author William Callahan
 *
 * Features:
 * - Collects every {@link ScheduledJob} bean in the context
 * - Applies schedule, enabled and run-on-start overrides from {@code app.jobs.definitions}
 * - Accepts a refresh interval in hours in place of a cron expression
 * - Starts the scheduler unless {@code app.jobs.scheduler-enabled} is false
 */

package com.williamcallahan.media_list_sync.scheduler;

import com.williamcallahan.media_list_sync.config.JobsProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.ApplicationListener;
import org.springframework.stereotype.Component;

import java.util.List;

@Slf4j
@Component
public class JobRegistrar implements ApplicationListener<ApplicationReadyEvent> {

    private final JobScheduler jobScheduler;
    private final List<ScheduledJob> jobs;
    private final JobsProperties jobsProperties;

    public JobRegistrar(JobScheduler jobScheduler, List<ScheduledJob> jobs, JobsProperties jobsProperties) {
        this.jobScheduler = jobScheduler;
        this.jobs = jobs;
        this.jobsProperties = jobsProperties;
    }

    @Override
    public void onApplicationEvent(ApplicationReadyEvent event) {
        registerAll();
        if (!jobsProperties.isSchedulerEnabled()) {
            log.info("Job scheduler disabled by configuration; {} job(s) registered but not scheduled", jobs.size());
            return;
        }
        jobScheduler.start();
    }

    void registerAll() {
        for (ScheduledJob job : jobs) {
            JobsProperties.Definition definition = jobsProperties.getDefinitions().get(job.name());
            String schedule = resolveSchedule(job, definition);
            JobOptions options = resolveOptions(job.defaultOptions(), definition);
            jobScheduler.register(job.name(), schedule, job, options);
        }
    }

    private static String resolveSchedule(ScheduledJob job, JobsProperties.Definition definition) {
        if (definition == null) {
            return job.defaultSchedule();
        }
        if (definition.getSchedule() != null && !definition.getSchedule().isBlank()) {
            return definition.getSchedule();
        }
        if (definition.getRefreshIntervalHours() != null) {
            return RefreshScheduleCalculator.toCron(definition.getRefreshIntervalHours(), definition.getRefreshTime());
        }
        return job.defaultSchedule();
    }

    private static JobOptions resolveOptions(JobOptions defaults, JobsProperties.Definition definition) {
        if (definition == null) {
            return defaults;
        }
        JobOptions options = defaults;
        if (definition.getEnabled() != null) {
            options = options.withEnabled(definition.getEnabled());
        }
        if (definition.getRunOnStart() != null) {
            options = options.withRunOnStart(definition.getRunOnStart());
        }
        return options;
    }
}
