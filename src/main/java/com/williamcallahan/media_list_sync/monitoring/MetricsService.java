/**
 * Service for tracking scheduler and outbound-call metrics
 * Provides counters and timers for job runs, retries, rate-limit waits and token refreshes
 *
 * @author William Callahan
 */

package com.williamcallahan.media_list_sync.monitoring;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;

@Service
public class MetricsService {

    public static final String OUTCOME_SUCCESS = "success";
    public static final String OUTCOME_FAILURE = "failure";
    public static final String OUTCOME_SKIPPED = "skipped";

    private final MeterRegistry meterRegistry;

    private final Counter retryAttempts;
    private final Counter rateLimitWaits;
    private final Timer rateLimitWaitTimer;

    public MetricsService(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;

        this.retryAttempts = Counter.builder("sync.retry.attempts")
            .description("Number of retries scheduled after transient upstream failures")
            .register(meterRegistry);

        this.rateLimitWaits = Counter.builder("sync.rate_limit.waits")
            .description("Number of outbound calls delayed by the rate limiter")
            .register(meterRegistry);

        this.rateLimitWaitTimer = Timer.builder("sync.rate_limit.wait.duration")
            .description("Time callers spent waiting for a rate limiter slot")
            .register(meterRegistry);
    }

    public void recordJobRun(String jobName, String outcome) {
        meterRegistry.counter("sync.jobs.runs", "job", jobName, "outcome", outcome).increment();
    }

    public void recordJobDuration(String jobName, Duration duration) {
        Timer.builder("sync.jobs.duration")
            .description("Job handler execution time")
            .tag("job", jobName)
            .register(meterRegistry)
            .record(duration);
    }

    public void incrementRetryAttempt() {
        retryAttempts.increment();
    }

    public void recordRateLimitWait(Duration wait) {
        rateLimitWaits.increment();
        rateLimitWaitTimer.record(wait);
    }

    public void recordTokenRefresh(String integration, String outcome) {
        meterRegistry.counter("sync.oauth.refreshes", "integration", integration, "outcome", outcome).increment();
    }
}
