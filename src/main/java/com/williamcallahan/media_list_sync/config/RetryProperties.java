package com.williamcallahan.media_list_sync.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Defaults for retrying calls to third-party catalog, tracking and OAuth endpoints.
 */
@Component
@ConfigurationProperties(prefix = "app.retry")
public class RetryProperties {

    /**
     * Total attempts including the first call.
     */
    private int maxAttempts = 4;

    private Duration initialBackoff = Duration.ofSeconds(1);

    private Duration maxBackoff = Duration.ofSeconds(30);

    /**
     * Random spread applied to each backoff delay, as a fraction.
     */
    private double jitter = 0.1;

    private Set<Integer> retryableStatusCodes = new LinkedHashSet<>(List.of(408, 429, 500, 502, 503, 504));

    private Set<String> retryableNetworkCodes =
            new LinkedHashSet<>(List.of("ECONNRESET", "ETIMEDOUT", "ECONNREFUSED", "ENOTFOUND", "EAI_AGAIN"));

    public int getMaxAttempts() { return maxAttempts; }
    public void setMaxAttempts(int maxAttempts) { this.maxAttempts = maxAttempts; }

    public Duration getInitialBackoff() { return initialBackoff; }
    public void setInitialBackoff(Duration initialBackoff) { this.initialBackoff = initialBackoff; }

    public Duration getMaxBackoff() { return maxBackoff; }
    public void setMaxBackoff(Duration maxBackoff) { this.maxBackoff = maxBackoff; }

    public double getJitter() { return jitter; }
    public void setJitter(double jitter) { this.jitter = jitter; }

    public Set<Integer> getRetryableStatusCodes() { return retryableStatusCodes; }
    public void setRetryableStatusCodes(Set<Integer> retryableStatusCodes) { this.retryableStatusCodes = retryableStatusCodes; }

    public Set<String> getRetryableNetworkCodes() { return retryableNetworkCodes; }
    public void setRetryableNetworkCodes(Set<String> retryableNetworkCodes) { this.retryableNetworkCodes = retryableNetworkCodes; }
}
