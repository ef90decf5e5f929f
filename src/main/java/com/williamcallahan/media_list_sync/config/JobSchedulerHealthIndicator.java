/**
 * Health indicator for the background job scheduler
 *
 * @author William Callahan
 *
 * Reports whether the scheduler is started and the status of every registered job
 */

package com.williamcallahan.media_list_sync.config;

import com.williamcallahan.media_list_sync.scheduler.JobScheduler;
import com.williamcallahan.media_list_sync.scheduler.JobStatusSnapshot;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Component("jobSchedulerHealthIndicator")
public class JobSchedulerHealthIndicator implements HealthIndicator {

    private final JobScheduler jobScheduler;

    public JobSchedulerHealthIndicator(JobScheduler jobScheduler) {
        this.jobScheduler = jobScheduler;
    }

    /**
     * UP while the scheduler is started, OUT_OF_SERVICE otherwise. Job failures are reported as
     * details and do not take the indicator down.
     */
    @Override
    public Health health() {
        List<JobStatusSnapshot> snapshots = jobScheduler.getStatus();
        Map<String, Object> jobs = new LinkedHashMap<>();
        for (JobStatusSnapshot snapshot : snapshots) {
            jobs.put(snapshot.name(), toDetail(snapshot));
        }
        Health.Builder builder = jobScheduler.isStarted() ? Health.up() : Health.outOfService();
        return builder
            .withDetail("started", jobScheduler.isStarted())
            .withDetail("jobs", jobs)
            .build();
    }

    private static Map<String, Object> toDetail(JobStatusSnapshot snapshot) {
        Map<String, Object> detail = new LinkedHashMap<>();
        detail.put("schedule", snapshot.schedule());
        detail.put("enabled", snapshot.enabled());
        detail.put("running", snapshot.running());
        detail.put("lastRun", snapshot.lastRun());
        detail.put("lastError", snapshot.lastError());
        detail.put("runCount", snapshot.runCount());
        detail.put("nextRun", snapshot.nextRun());
        return detail;
    }
}
