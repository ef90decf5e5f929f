package com.williamcallahan.media_list_sync.service.retry;

import com.williamcallahan.media_list_sync.exception.HttpStatusException;
import com.williamcallahan.media_list_sync.exception.NetworkException;

import java.time.Duration;
import java.util.Set;

/**
 * Per call-site retry settings.
 * <p>
 * Backoff is exponential (factor 2) starting at {@code initialBackoff}, randomized by
 * {@code jitter} (a 0..1 fraction) and capped at {@code maxBackoff}.
 *
 * @param maxAttempts total attempts including the first call, at least 1
 * @param retryableStatusCodes HTTP statuses worth another attempt
 * @param retryableNetworkCodes transport error codes worth another attempt
 * @param initialBackoff delay before the first retry
 * @param maxBackoff upper bound for any single delay
 * @param jitter random spread applied to each delay
 */
public record RetryPolicy(int maxAttempts,
                          Set<Integer> retryableStatusCodes,
                          Set<String> retryableNetworkCodes,
                          Duration initialBackoff,
                          Duration maxBackoff,
                          double jitter) {

    public static final Set<Integer> TRANSIENT_STATUS_CODES = Set.of(408, 429, 500, 502, 503, 504);
    public static final Set<String> TRANSIENT_NETWORK_CODES =
            Set.of("ECONNRESET", "ETIMEDOUT", "ECONNREFUSED", "ENOTFOUND", "EAI_AGAIN");

    private static final Duration DEFAULT_INITIAL_BACKOFF = Duration.ofSeconds(1);
    private static final Duration DEFAULT_MAX_BACKOFF = Duration.ofSeconds(30);
    private static final double DEFAULT_JITTER = 0.1;

    public RetryPolicy {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1");
        }
        retryableStatusCodes = retryableStatusCodes == null ? Set.of() : Set.copyOf(retryableStatusCodes);
        retryableNetworkCodes = retryableNetworkCodes == null ? Set.of() : Set.copyOf(retryableNetworkCodes);
        initialBackoff = initialBackoff == null ? DEFAULT_INITIAL_BACKOFF : initialBackoff;
        maxBackoff = maxBackoff == null ? DEFAULT_MAX_BACKOFF : maxBackoff;
        if (jitter < 0 || jitter > 1) {
            throw new IllegalArgumentException("jitter must be between 0 and 1");
        }
    }

    /**
     * Status-code-only policy with the default backoff.
     */
    public static RetryPolicy of(int maxAttempts, Set<Integer> retryableStatusCodes) {
        return new RetryPolicy(maxAttempts, retryableStatusCodes, Set.of(),
                DEFAULT_INITIAL_BACKOFF, DEFAULT_MAX_BACKOFF, DEFAULT_JITTER);
    }

    /**
     * Policy for quota-constrained third-party APIs: 4 attempts, transient statuses and transport errors.
     */
    public static RetryPolicy standard() {
        return new RetryPolicy(4, TRANSIENT_STATUS_CODES, TRANSIENT_NETWORK_CODES,
                DEFAULT_INITIAL_BACKOFF, DEFAULT_MAX_BACKOFF, DEFAULT_JITTER);
    }

    public RetryPolicy withBackoff(Duration initial, Duration max) {
        return new RetryPolicy(maxAttempts, retryableStatusCodes, retryableNetworkCodes, initial, max, jitter);
    }

    public boolean isRetryable(Throwable failure) {
        if (failure instanceof HttpStatusException httpError) {
            return retryableStatusCodes.contains(httpError.getStatus());
        }
        if (failure instanceof NetworkException networkError) {
            return retryableNetworkCodes.contains(networkError.getCode());
        }
        return false;
    }
}
