package com.williamcallahan.media_list_sync.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Minimum spacing between the starts of consecutive calls to each external service.
 */
@Component
@ConfigurationProperties(prefix = "app.rate-limit")
public class RateLimitProperties {

    /**
     * Spacing applied to service keys without an explicit entry.
     */
    private Duration defaultMinInterval = Duration.ofMillis(600);

    /**
     * Per-service spacing keyed by provider identity (tmdb, trakt, mdblist, ...).
     */
    private Map<String, Duration> services = new HashMap<>();

    public Duration getDefaultMinInterval() {
        return defaultMinInterval;
    }

    public void setDefaultMinInterval(Duration defaultMinInterval) {
        this.defaultMinInterval = defaultMinInterval;
    }

    public Map<String, Duration> getServices() {
        return services;
    }

    public void setServices(Map<String, Duration> services) {
        this.services = services;
    }

    public Duration minIntervalFor(String serviceKey) {
        if (serviceKey == null) {
            return defaultMinInterval;
        }
        Duration configured = services.get(serviceKey.toLowerCase(Locale.ROOT));
        return configured != null ? configured : defaultMinInterval;
    }
}
