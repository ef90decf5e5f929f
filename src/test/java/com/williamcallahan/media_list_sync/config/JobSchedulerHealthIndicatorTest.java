package com.williamcallahan.media_list_sync.config;

import com.williamcallahan.media_list_sync.scheduler.JobScheduler;
import com.williamcallahan.media_list_sync.scheduler.JobStatusSnapshot;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.Status;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class JobSchedulerHealthIndicatorTest {

    @Mock
    private JobScheduler jobScheduler;

    @Test
    @SuppressWarnings("unchecked")
    void health_started_reportsUpWithJobDetails() {
        Instant lastRun = Instant.parse("2024-05-01T12:00:00Z");
        when(jobScheduler.isStarted()).thenReturn(true);
        when(jobScheduler.getStatus()).thenReturn(List.of(
                new JobStatusSnapshot("trakt-token-refresh", "0 */6 * * *", true, false, lastRun,
                        "Trakt token expired and no refresh token available", 3, null)));

        Health health = new JobSchedulerHealthIndicator(jobScheduler).health();

        assertThat(health.getStatus()).isEqualTo(Status.UP);
        Map<String, Object> jobs = (Map<String, Object>) health.getDetails().get("jobs");
        Map<String, Object> detail = (Map<String, Object>) jobs.get("trakt-token-refresh");
        assertThat(detail)
                .containsEntry("schedule", "0 */6 * * *")
                .containsEntry("runCount", 3L)
                .containsEntry("lastRun", lastRun)
                .containsEntry("lastError", "Trakt token expired and no refresh token available");
    }

    @Test
    void health_stopped_reportsOutOfService() {
        when(jobScheduler.isStarted()).thenReturn(false);
        when(jobScheduler.getStatus()).thenReturn(List.of());

        Health health = new JobSchedulerHealthIndicator(jobScheduler).health();

        assertThat(health.getStatus()).isEqualTo(Status.OUT_OF_SERVICE);
        assertThat(health.getDetails()).containsEntry("started", false);
    }
}
