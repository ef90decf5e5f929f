/**
 * Keeps OAuth access tokens fresh for connected integrations
 *
 * @author William Callahan
 *
 * Features:
 * - Refreshes eagerly when the token expires within 24 hours, or its expiry is unknown
 * - Tokens are decrypted on read and re-encrypted on write through {@link CredentialVault}
 * - Refresh calls go through the retry executor with the standard upstream policy
 * - Single-flight per integration: concurrent callers share one lookup/refresh and its result
 */
package com.williamcallahan.media_list_sync.service.auth;

import com.williamcallahan.media_list_sync.config.OAuthClientProperties;
import com.williamcallahan.media_list_sync.exception.ConfigurationException;
import com.williamcallahan.media_list_sync.exception.HttpStatusException;
import com.williamcallahan.media_list_sync.exception.NotConnectedException;
import com.williamcallahan.media_list_sync.exception.ReauthorizationRequiredException;
import com.williamcallahan.media_list_sync.exception.SyncException;
import com.williamcallahan.media_list_sync.monitoring.MetricsService;
import com.williamcallahan.media_list_sync.repository.CredentialStore;
import com.williamcallahan.media_list_sync.repository.StoredCredential;
import com.williamcallahan.media_list_sync.service.retry.RetryExecutor;
import com.williamcallahan.media_list_sync.service.retry.RetryPolicy;
import com.williamcallahan.media_list_sync.service.security.CredentialVault;
import com.williamcallahan.media_list_sync.service.security.EncryptedSecret;
import com.williamcallahan.media_list_sync.util.ExternalApiLogger;
import com.williamcallahan.media_list_sync.util.LoggingUtils;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

@Service
@Slf4j
public class TokenRefreshManager {

    static final Duration REFRESH_LOOKAHEAD = Duration.ofHours(24);
    // Bad Gateway: the authorization server answered 2xx with an unusable body
    static final int INVALID_RESPONSE_STATUS = 502;

    private final CredentialStore credentialStore;
    private final CredentialVault credentialVault;
    private final OAuthTokenClient tokenClient;
    private final OAuthClientProperties clientProperties;
    private final RetryExecutor retryExecutor;
    private final RetryPolicy retryPolicy;
    private final MetricsService metricsService;
    private final Clock clock;

    private final Map<String, Mono<String>> inFlight = new ConcurrentHashMap<>();

    @Autowired
    public TokenRefreshManager(CredentialStore credentialStore,
                               CredentialVault credentialVault,
                               OAuthTokenClient tokenClient,
                               OAuthClientProperties clientProperties,
                               RetryExecutor retryExecutor,
                               @Qualifier("upstreamRetryPolicy") RetryPolicy retryPolicy,
                               MetricsService metricsService) {
        this(credentialStore, credentialVault, tokenClient, clientProperties, retryExecutor, retryPolicy,
                metricsService, Clock.systemUTC());
    }

    TokenRefreshManager(CredentialStore credentialStore,
                        CredentialVault credentialVault,
                        OAuthTokenClient tokenClient,
                        OAuthClientProperties clientProperties,
                        RetryExecutor retryExecutor,
                        RetryPolicy retryPolicy,
                        MetricsService metricsService,
                        Clock clock) {
        this.credentialStore = credentialStore;
        this.credentialVault = credentialVault;
        this.tokenClient = tokenClient;
        this.clientProperties = clientProperties;
        this.retryExecutor = retryExecutor;
        this.retryPolicy = retryPolicy;
        this.metricsService = metricsService;
        this.clock = clock;
    }

    /**
     * True when {@code expiresAt} is unknown or falls inside the 24 hour lookahead window.
     */
    public boolean tokenNeedsRefresh(Instant expiresAt) {
        if (expiresAt == null) {
            return true;
        }
        return expiresAt.isBefore(clock.instant().plus(REFRESH_LOOKAHEAD));
    }

    /**
     * Performs a refresh grant and returns the new pair with {@code expiresAt = now + expires_in}.
     * When the server omits a new refresh token, the one presented is kept. A success body without an
     * access token or a positive lifetime fails with {@link HttpStatusException} (502) and is not retried.
     */
    public Mono<OAuthTokenPair> refreshToken(String refreshToken, ClientCredentials credentials) {
        if (credentials == null || !credentials.isConfigured()) {
            return Mono.error(new ConfigurationException("OAuth client credentials not configured"));
        }
        return retryExecutor.withRetry("oauth token refresh",
                        () -> tokenClient.refresh(refreshToken, credentials), retryPolicy)
                .flatMap(response -> {
                    String problem = validate(response);
                    if (problem != null) {
                        return Mono.<OAuthTokenPair>error(new HttpStatusException(
                                "OAuth token response " + problem, INVALID_RESPONSE_STATUS));
                    }
                    return Mono.just(new OAuthTokenPair(
                            response.accessToken(),
                            hasText(response.refreshToken()) ? response.refreshToken() : refreshToken,
                            clock.instant().plusSeconds(response.expiresIn())));
                });
    }

    /**
     * Returns a usable access token for {@code integration}, refreshing and persisting a new pair when
     * the current one is stale.
     *
     * @throws NotConnectedException (as error signal) when no access token is on record
     * @throws ReauthorizationRequiredException (as error signal) when stale and no refresh token is stored
     */
    public Mono<String> ensureValidToken(String integration) {
        // Entry is dropped before the result reaches subscribers, so a caller arriving after completion starts fresh
        return Mono.defer(() -> inFlight.computeIfAbsent(integration, key ->
                resolveAccessToken(key)
                        .doOnTerminate(() -> inFlight.remove(key))
                        .cache()));
    }

    /**
     * Encrypts and stores a token pair for {@code integration}, replacing any previous record.
     */
    public Mono<Void> saveTokens(String integration, OAuthTokenPair tokens) {
        return Mono.fromRunnable(() -> credentialStore.save(new StoredCredential(
                        integration,
                        credentialVault.encrypt(tokens.accessToken()).orElse(null),
                        credentialVault.encrypt(tokens.refreshToken()).orElse(null),
                        tokens.expiresAt())))
                .subscribeOn(Schedulers.boundedElastic())
                .then();
    }

    private Mono<String> resolveAccessToken(String integration) {
        return Mono.fromCallable(() -> credentialStore.findByIntegration(integration))
                .subscribeOn(Schedulers.boundedElastic())
                .flatMap(stored -> {
                    Optional<String> accessToken = stored.map(StoredCredential::accessToken).flatMap(this::decrypt);
                    if (accessToken.isEmpty()) {
                        return Mono.<String>error(new NotConnectedException(integration));
                    }
                    Instant expiresAt = stored.get().expiresAt();
                    if (!tokenNeedsRefresh(expiresAt)) {
                        return Mono.just(accessToken.get());
                    }
                    Optional<String> refreshToken = decrypt(stored.get().refreshToken());
                    if (refreshToken.isEmpty()) {
                        return Mono.<String>error(new ReauthorizationRequiredException(integration));
                    }
                    return refreshAndPersist(integration, refreshToken.get());
                });
    }

    private Mono<String> refreshAndPersist(String integration, String refreshToken) {
        log.info("Access token for {} expires within {}h; refreshing", integration, REFRESH_LOOKAHEAD.toHours());
        return refreshToken(refreshToken, clientProperties.credentialsFor(integration))
                .flatMap(tokens -> saveTokens(integration, tokens).thenReturn(tokens.accessToken()))
                .doOnSuccess(token -> {
                    metricsService.recordTokenRefresh(integration, MetricsService.OUTCOME_SUCCESS);
                    ExternalApiLogger.logTokenRefresh(log, integration, "refreshed");
                })
                .doOnError(error -> {
                    metricsService.recordTokenRefresh(integration, MetricsService.OUTCOME_FAILURE);
                    String kind = error instanceof SyncException syncError ? syncError.kind().name() : "UNEXPECTED";
                    LoggingUtils.error(log, null, "Token refresh for {} failed ({}): {}",
                            integration, kind, LoggingUtils.rootMessage(error));
                });
    }

    private static String validate(OAuthTokenClient.TokenResponse response) {
        if (!hasText(response.accessToken())) {
            return "missing access_token";
        }
        if (response.expiresIn() == null || response.expiresIn() <= 0) {
            return "missing or non-positive expires_in";
        }
        return null;
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }

    private Optional<String> decrypt(EncryptedSecret secret) {
        return credentialVault.decrypt(secret);
    }
}
