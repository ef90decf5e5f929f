/**
 * Authorized client for the Trakt list API
 *
 * @author William Callahan
 *
 * Features:
 * - Obtains a valid access token from the token refresh manager before every call
 * - Spaces calls through the shared "trakt" rate limiter slot
 * - Retries transient failures with the upstream retry policy
 * - Exposes the user's lists, list items and watchlist as raw JSON
 */

package com.williamcallahan.media_list_sync.service.external;

import com.fasterxml.jackson.databind.JsonNode;
import com.williamcallahan.media_list_sync.config.OAuthClientProperties;
import com.williamcallahan.media_list_sync.service.auth.ClientCredentials;
import com.williamcallahan.media_list_sync.service.auth.TokenRefreshManager;
import com.williamcallahan.media_list_sync.service.ratelimit.ApiRateLimiter;
import com.williamcallahan.media_list_sync.service.retry.RetryExecutor;
import com.williamcallahan.media_list_sync.service.retry.RetryPolicy;
import com.williamcallahan.media_list_sync.util.ErrorHandlingUtils;
import com.williamcallahan.media_list_sync.util.ExternalApiLogger;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

@Slf4j
@Service
public class TraktApiClient {

    static final String INTEGRATION = "trakt";
    static final String API_VERSION = "2";

    private final WebClient webClient;
    private final OAuthClientProperties oauthClientProperties;
    private final TokenRefreshManager tokenRefreshManager;
    private final ApiRateLimiter rateLimiter;
    private final RetryExecutor retryExecutor;
    private final RetryPolicy retryPolicy;

    public TraktApiClient(WebClient.Builder webClientBuilder,
                          OAuthClientProperties oauthClientProperties,
                          TokenRefreshManager tokenRefreshManager,
                          ApiRateLimiter rateLimiter,
                          RetryExecutor retryExecutor,
                          @Qualifier("upstreamRetryPolicy") RetryPolicy retryPolicy) {
        this.webClient = webClientBuilder.build();
        this.oauthClientProperties = oauthClientProperties;
        this.tokenRefreshManager = tokenRefreshManager;
        this.rateLimiter = rateLimiter;
        this.retryExecutor = retryExecutor;
        this.retryPolicy = retryPolicy;
    }

    public Mono<JsonNode> getMyLists() {
        return get("/users/me/lists");
    }

    public Mono<JsonNode> getListItems(String listId) {
        return get("/users/me/lists/" + listId + "/items");
    }

    /**
     * @param type {@code movies}, {@code shows} or null for everything
     */
    public Mono<JsonNode> getWatchlist(String type) {
        return get(type == null || type.isBlank() ? "/users/me/watchlist" : "/users/me/watchlist/" + type);
    }

    /**
     * Fails with {@code NotConnectedException} or {@code ReauthorizationRequiredException} when no
     * usable token exists; upstream failures surface after retries as {@code RetryExhaustedException}
     * or the non-retryable error itself.
     */
    Mono<JsonNode> get(String path) {
        ClientCredentials credentials = oauthClientProperties.credentialsFor(INTEGRATION);
        return tokenRefreshManager.ensureValidToken(INTEGRATION)
            .flatMap(accessToken -> retryExecutor.withRetry("trakt GET " + path,
                () -> rateLimiter.waitForQuota(INTEGRATION).then(request(credentials, path, accessToken)),
                retryPolicy));
    }

    private Mono<JsonNode> request(ClientCredentials credentials, String path, String accessToken) {
        ExternalApiLogger.logHttpRequest(log, "Trakt", "GET", path, true);
        return webClient.get()
            .uri(credentials.baseUrl() + path)
            .accept(MediaType.APPLICATION_JSON)
            .header("trakt-api-version", API_VERSION)
            .header("trakt-api-key", credentials.clientId())
            .header(HttpHeaders.AUTHORIZATION, "Bearer " + accessToken)
            .retrieve()
            .onStatus(HttpStatusCode::isError, response -> ErrorHandlingUtils.toHttpStatusError(response, "Trakt"))
            .bodyToMono(JsonNode.class)
            .onErrorMap(error -> ErrorHandlingUtils.toNetworkError(error, "Trakt", credentials.baseUrl()));
    }
}
