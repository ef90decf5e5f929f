/**
 * Configuration for retry policies applied to upstream calls
 *
 * @author William Callahan
 *
 * Features:
 * - Builds the shared policy for quota-constrained third-party APIs from {@link RetryProperties}
 * - Exponential backoff with jitter so retries from parallel jobs spread out
 * - 4xx responses other than 408/429 fail fast
 */

package com.williamcallahan.media_list_sync.config;

import com.williamcallahan.media_list_sync.service.retry.RetryPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class RetryConfig {

    private static final Logger logger = LoggerFactory.getLogger(RetryConfig.class);

    /**
     * Policy used by the metadata and OAuth clients
     *
     * @param properties bound {@code app.retry.*} settings
     * @return RetryPolicy for upstream HTTP calls
     */
    @Bean("upstreamRetryPolicy")
    public RetryPolicy upstreamRetryPolicy(RetryProperties properties) {
        RetryPolicy policy = new RetryPolicy(
                properties.getMaxAttempts(),
                properties.getRetryableStatusCodes(),
                properties.getRetryableNetworkCodes(),
                properties.getInitialBackoff(),
                properties.getMaxBackoff(),
                properties.getJitter());
        logger.info("Upstream retry policy: {} attempts, backoff {} -> {}, statuses {}",
                policy.maxAttempts(), policy.initialBackoff(), policy.maxBackoff(), policy.retryableStatusCodes());
        return policy;
    }
}
