package com.williamcallahan.media_list_sync.monitoring;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class MetricsServiceTest {

    private SimpleMeterRegistry registry;
    private MetricsService metricsService;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        metricsService = new MetricsService(registry);
    }

    @Test
    void recordJobRun_tagsByJobAndOutcome() {
        metricsService.recordJobRun("sync", MetricsService.OUTCOME_SUCCESS);
        metricsService.recordJobRun("sync", MetricsService.OUTCOME_SUCCESS);
        metricsService.recordJobRun("sync", MetricsService.OUTCOME_SKIPPED);

        assertThat(registry.get("sync.jobs.runs").tags("job", "sync", "outcome", "success").counter().count())
                .isEqualTo(2.0);
        assertThat(registry.get("sync.jobs.runs").tags("job", "sync", "outcome", "skipped").counter().count())
                .isEqualTo(1.0);
    }

    @Test
    void recordJobDuration_recordsPerJobTimer() {
        metricsService.recordJobDuration("sync", Duration.ofMillis(1500));

        assertThat(registry.get("sync.jobs.duration").tag("job", "sync").timer().totalTime(TimeUnit.MILLISECONDS))
                .isEqualTo(1500.0);
    }

    @Test
    void recordRateLimitWait_countsAndTimesWaits() {
        metricsService.recordRateLimitWait(Duration.ofMillis(200));

        assertThat(registry.get("sync.rate_limit.waits").counter().count()).isEqualTo(1.0);
        assertThat(registry.get("sync.rate_limit.wait.duration").timer().count()).isEqualTo(1);
    }

    @Test
    void recordTokenRefresh_tagsIntegration() {
        metricsService.recordTokenRefresh("trakt", MetricsService.OUTCOME_FAILURE);

        assertThat(registry.get("sync.oauth.refreshes").tags("integration", "trakt", "outcome", "failure")
                .counter().count()).isEqualTo(1.0);
    }
}
