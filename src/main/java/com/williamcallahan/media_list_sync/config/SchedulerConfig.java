/**
 * Configuration for the background job scheduler
 *
 * @author William Callahan
 *
 * Features:
 * - Dedicated thread pool that delivers cron firings
 * - Cron trigger source evaluated in the configured time zone
 * - Startup runs dispatched on Reactor's bounded-elastic scheduler
 */

package com.williamcallahan.media_list_sync.config;

import com.williamcallahan.media_list_sync.monitoring.MetricsService;
import com.williamcallahan.media_list_sync.scheduler.CronTriggerSource;
import com.williamcallahan.media_list_sync.scheduler.JobScheduler;
import com.williamcallahan.media_list_sync.scheduler.JobTriggerSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;
import reactor.core.scheduler.Schedulers;

import java.time.Clock;
import java.time.ZoneId;

@Configuration
public class SchedulerConfig {

    private static final Logger logger = LoggerFactory.getLogger(SchedulerConfig.class);

    @Bean(name = "jobTaskScheduler")
    public ThreadPoolTaskScheduler jobTaskScheduler(JobsProperties jobsProperties) {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(Math.max(1, jobsProperties.getPoolSize()));
        scheduler.setThreadNamePrefix("job-trigger-");
        scheduler.setWaitForTasksToCompleteOnShutdown(true);
        scheduler.setAwaitTerminationSeconds(30);
        scheduler.setErrorHandler(t -> logger.error("Uncaught error in job trigger thread", t));
        return scheduler;
    }

    @Bean
    public JobTriggerSource jobTriggerSource(@Qualifier("jobTaskScheduler") ThreadPoolTaskScheduler jobTaskScheduler,
                                             JobsProperties jobsProperties) {
        ZoneId zone = jobsProperties.getTimeZone() == null || jobsProperties.getTimeZone().isBlank()
                ? ZoneId.systemDefault()
                : ZoneId.of(jobsProperties.getTimeZone());
        logger.info("Cron schedules evaluated in time zone {}", zone);
        return new CronTriggerSource(jobTaskScheduler, zone);
    }

    @Bean
    public JobScheduler jobScheduler(JobTriggerSource jobTriggerSource, MetricsService metricsService) {
        return new JobScheduler(jobTriggerSource, Schedulers.boundedElastic(), metricsService, Clock.systemUTC());
    }
}
