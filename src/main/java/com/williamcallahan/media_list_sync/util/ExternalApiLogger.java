package com.williamcallahan.media_list_sync.util;

import org.slf4j.Logger;

/**
 * Uniform log lines for outbound calls to catalog, tracking and OAuth services.
 *
 * Every line is prefixed with {@code [EXTERNAL-API]} and the service name so a single grep
 * follows one provider across rate-limit waits, retries and responses.
 */
public final class ExternalApiLogger {

    private static final String PREFIX = "[EXTERNAL-API]";

    private ExternalApiLogger() {
    }

    public static void logHttpRequest(Logger log, String apiName, String method, String path, boolean authenticated) {
        String authType = authenticated ? "AUTHENTICATED" : "UNAUTHENTICATED";
        log.debug("{} [{}] {} {} request to: {}", PREFIX, apiName, authType, method, path);
    }

    public static void logApiCallSuccess(Logger log, String apiName, String operation, String query) {
        log.debug("{} [{}] SUCCESS: {} for query='{}'", PREFIX, apiName, operation, query);
    }

    public static void logApiCallFailure(Logger log, String apiName, String operation, String query, String reason) {
        log.warn("{} [{}] FAILURE: {} failed for query='{}' - {}", PREFIX, apiName, operation, query, reason);
    }

    /**
     * Log a retry scheduled after a transient failure
     */
    public static void logRetry(Logger log, String operation, long attempt, long maxAttempts, String reason) {
        log.warn("{} [RETRY] {} attempt {}/{} failed ({}), retrying", PREFIX, operation, attempt, maxAttempts, reason);
    }

    /**
     * Log a caller being held back by the per-service rate limiter
     */
    public static void logRateLimitWait(Logger log, String serviceKey, long waitMillis) {
        log.debug("{} [{}] RATE-LIMIT: waiting {}ms before next call", PREFIX, serviceKey, waitMillis);
    }

    public static void logTokenRefresh(Logger log, String integration, String outcome) {
        log.info("{} [{}] TOKEN-REFRESH: {}", PREFIX, integration, outcome);
    }
}
