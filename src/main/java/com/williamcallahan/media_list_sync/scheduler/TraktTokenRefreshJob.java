package com.williamcallahan.media_list_sync.scheduler;

import com.williamcallahan.media_list_sync.exception.NotConnectedException;
import com.williamcallahan.media_list_sync.service.auth.TokenRefreshManager;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

/**
 * Keeps the Trakt access token fresh ahead of expiry so list syncs never stall on a refresh.
 * An integration that was never connected is a no-op; a token that can no longer be
 * refreshed fails the run and shows up as the job's last error.
 */
@Slf4j
@Component
public class TraktTokenRefreshJob implements ScheduledJob {

    static final String NAME = "trakt-token-refresh";
    static final String INTEGRATION = "trakt";

    private final TokenRefreshManager tokenRefreshManager;

    public TraktTokenRefreshJob(TokenRefreshManager tokenRefreshManager) {
        this.tokenRefreshManager = tokenRefreshManager;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public String defaultSchedule() {
        return "0 */6 * * *";
    }

    @Override
    public Mono<String> execute(JobContext context) {
        return tokenRefreshManager.ensureValidToken(INTEGRATION)
            .map(token -> "Trakt access token valid")
            .onErrorResume(NotConnectedException.class, e -> {
                log.info("Trakt not connected, nothing to refresh");
                return Mono.empty();
            });
    }
}
