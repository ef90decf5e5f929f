/**
 * Cron trigger source backed by Spring's {@link TaskScheduler}
 *
 * @author William Callahan
 *
 * Features:
 * - Binds 5-field cron expressions to {@link CronTrigger}s on the job trigger pool
 * - Stop cancels future firings without interrupting one in progress
 * - Stopped triggers can be started again
 */

package com.williamcallahan.media_list_sync.scheduler;

import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.scheduling.support.CronTrigger;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.util.Optional;
import java.util.concurrent.ScheduledFuture;

@Slf4j
public class CronTriggerSource implements JobTriggerSource {

    private final TaskScheduler taskScheduler;
    private final ZoneId zone;
    private final Clock clock;

    public CronTriggerSource(TaskScheduler taskScheduler, ZoneId zone) {
        this.taskScheduler = taskScheduler;
        this.zone = zone;
        this.clock = Clock.system(zone);
    }

    @Override
    public void validate(String schedule) {
        CronExpressions.toSpringExpression(schedule);
    }

    @Override
    public ScheduledTrigger bind(String jobName, String schedule, Runnable firing) {
        CronTriggerHandle handle = new CronTriggerHandle(jobName, schedule, firing);
        handle.start();
        return handle;
    }

    private final class CronTriggerHandle implements ScheduledTrigger {

        private final String jobName;
        private final String schedule;
        private final CronTrigger cronTrigger;
        private final Runnable firing;
        private ScheduledFuture<?> future;

        private CronTriggerHandle(String jobName, String schedule, Runnable firing) {
            this.jobName = jobName;
            this.schedule = schedule;
            this.cronTrigger = new CronTrigger(CronExpressions.toSpringExpression(schedule), zone);
            this.firing = firing;
        }

        @Override
        public synchronized void start() {
            if (future != null) {
                return;
            }
            future = taskScheduler.schedule(firing, cronTrigger);
            log.debug("Bound cron trigger for job {} ({})", jobName, schedule);
        }

        @Override
        public synchronized void stop() {
            if (future == null) {
                return;
            }
            future.cancel(false);
            future = null;
            log.debug("Cancelled cron trigger for job {}", jobName);
        }

        @Override
        public synchronized boolean isActive() {
            return future != null;
        }

        @Override
        public Optional<Instant> nextFireTime() {
            if (!isActive()) {
                return Optional.empty();
            }
            return CronExpressions.nextExecution(schedule, clock.instant(), zone);
        }
    }
}
