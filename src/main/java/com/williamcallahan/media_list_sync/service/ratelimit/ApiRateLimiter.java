/**
 * Per-service minimum-interval throttle for quota-constrained external APIs
 *
 * @author William Callahan
 *
 * Features:
 * - One start slot per service key; consecutive call starts are at least the configured spacing apart
 * - Slot reservation is an atomic read-modify-write, so concurrent callers queue behind each other
 *   instead of racing past the check together
 * - Waiting is non-blocking (Mono.delay) so callers never park a thread
 * - State is process-wide and created lazily on the first call for a key
 */

package com.williamcallahan.media_list_sync.service.ratelimit;

import com.williamcallahan.media_list_sync.config.RateLimitProperties;
import com.williamcallahan.media_list_sync.monitoring.MetricsService;
import com.williamcallahan.media_list_sync.util.ExternalApiLogger;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

@Service
@Slf4j
public class ApiRateLimiter {

    private final RateLimitProperties properties;
    private final MetricsService metricsService;
    private final Clock clock;

    // service key -> epoch millis of the most recently reserved call start
    private final Map<String, AtomicLong> lastCallTimestamps = new ConcurrentHashMap<>();

    @Autowired
    public ApiRateLimiter(RateLimitProperties properties, MetricsService metricsService) {
        this(properties, metricsService, Clock.systemUTC());
    }

    ApiRateLimiter(RateLimitProperties properties, MetricsService metricsService, Clock clock) {
        this.properties = properties;
        this.metricsService = metricsService;
        this.clock = clock;
    }

    /**
     * Completes once the caller may start its call to {@code serviceKey}.
     * The slot is reserved at subscription time, so each subscription claims its own slot.
     *
     * @throws IllegalArgumentException if {@code serviceKey} is null
     */
    public Mono<Void> waitForQuota(String serviceKey) {
        requireServiceKey(serviceKey);
        return Mono.defer(() -> {
            long waitMillis = reserveSlot(serviceKey);
            if (waitMillis <= 0) {
                return Mono.empty();
            }
            Duration wait = Duration.ofMillis(waitMillis);
            ExternalApiLogger.logRateLimitWait(log, serviceKey, waitMillis);
            metricsService.recordRateLimitWait(wait);
            return Mono.delay(wait).then();
        });
    }

    /**
     * Defers {@code call} until a slot for {@code serviceKey} is available.
     */
    public <T> Mono<T> throttle(String serviceKey, Mono<T> call) {
        return waitForQuota(serviceKey).then(call);
    }

    /**
     * Last reserved call start for a service, or 0 if the service has never been called.
     */
    public long lastCallTimestamp(String serviceKey) {
        requireServiceKey(serviceKey);
        AtomicLong last = lastCallTimestamps.get(serviceKey);
        return last == null ? 0L : last.get();
    }

    private static void requireServiceKey(String serviceKey) {
        if (serviceKey == null) {
            throw new IllegalArgumentException("Rate limiter service key must not be null");
        }
    }

    private long reserveSlot(String serviceKey) {
        long spacing = Math.max(0L, properties.minIntervalFor(serviceKey).toMillis());
        AtomicLong last = lastCallTimestamps.computeIfAbsent(serviceKey, key -> new AtomicLong(0L));
        long now = clock.millis();
        long slot = last.updateAndGet(previous -> Math.max(now, previous + spacing));
        return slot - now;
    }
}
