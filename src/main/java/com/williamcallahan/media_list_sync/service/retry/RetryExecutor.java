/**
 * Bounded retry for fallible asynchronous calls to upstream services
 *
 * @author William Callahan
 *
 * Features:
 * - Retries only failures the supplied {@link RetryPolicy} classifies as transient
 * - Non-retryable failures propagate on the first occurrence
 * - Exponential backoff with jitter between attempts
 * - Exhaustion surfaces as {@link RetryExhaustedException} wrapping the last failure
 */

package com.williamcallahan.media_list_sync.service.retry;

import com.williamcallahan.media_list_sync.exception.RetryExhaustedException;
import com.williamcallahan.media_list_sync.monitoring.MetricsService;
import com.williamcallahan.media_list_sync.util.ExternalApiLogger;
import com.williamcallahan.media_list_sync.util.LoggingUtils;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import reactor.util.retry.Retry;

import java.util.function.Supplier;

@Service
@Slf4j
public class RetryExecutor {

    private final MetricsService metricsService;

    public RetryExecutor(MetricsService metricsService) {
        this.metricsService = metricsService;
    }

    public <T> Mono<T> withRetry(Supplier<Mono<T>> operation, RetryPolicy policy) {
        return withRetry("upstream call", operation, policy);
    }

    /**
     * Subscribes to a fresh {@code operation} per attempt, at most {@code policy.maxAttempts()} times.
     *
     * @param operationName label used in logs and in the exhaustion message
     * @param operation factory for the call; invoked once per attempt
     * @param policy attempts, retryable classification and backoff
     * @return the first successful result
     */
    public <T> Mono<T> withRetry(String operationName, Supplier<Mono<T>> operation, RetryPolicy policy) {
        Retry retrySpec = Retry.backoff(policy.maxAttempts() - 1L, policy.initialBackoff())
                .maxBackoff(policy.maxBackoff())
                .jitter(policy.jitter())
                .filter(policy::isRetryable)
                .doBeforeRetry(signal -> {
                    metricsService.incrementRetryAttempt();
                    ExternalApiLogger.logRetry(log, operationName, signal.totalRetries() + 1, policy.maxAttempts(),
                            LoggingUtils.rootMessage(signal.failure()));
                })
                .onRetryExhaustedThrow((spec, signal) ->
                        new RetryExhaustedException(operationName, signal.totalRetries() + 1, signal.failure()));

        return Mono.defer(operation).retryWhen(retrySpec);
    }
}
