/**
 * Client for The Movie Database (TMDB) poster lookups
 *
 * @author William Callahan
 *
 * Features:
 * - Resolves poster URLs by TMDB id or by title and release year
 * - Spaces calls through the shared "tmdb" rate limiter slot
 * - Retries transient failures with the upstream retry policy
 * - Wraps calls in a Resilience4j circuit breaker and degrades to empty on any failure
 * - Returns empty without calling out when no API key is configured
 */

package com.williamcallahan.media_list_sync.service.external;

import com.fasterxml.jackson.databind.JsonNode;
import com.williamcallahan.media_list_sync.config.TmdbConfigurationProperties;
import com.williamcallahan.media_list_sync.service.ratelimit.ApiRateLimiter;
import com.williamcallahan.media_list_sync.service.retry.RetryExecutor;
import com.williamcallahan.media_list_sync.service.retry.RetryPolicy;
import com.williamcallahan.media_list_sync.util.ErrorHandlingUtils;
import com.williamcallahan.media_list_sync.util.ExternalApiLogger;
import com.williamcallahan.media_list_sync.util.LoggingUtils;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import io.github.resilience4j.reactor.circuitbreaker.operator.CircuitBreakerOperator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.util.UriBuilder;
import reactor.core.publisher.Mono;

import java.net.URI;
import java.util.function.Function;

@Slf4j
@Service
public class TmdbClient {

    static final String SERVICE_KEY = "tmdb";
    static final String CIRCUIT_BREAKER_NAME = "tmdb";

    private final WebClient webClient;
    private final TmdbConfigurationProperties.Api api;
    private final ApiRateLimiter rateLimiter;
    private final RetryExecutor retryExecutor;
    private final RetryPolicy retryPolicy;
    private final CircuitBreaker circuitBreaker;

    public TmdbClient(WebClient.Builder webClientBuilder,
                      TmdbConfigurationProperties properties,
                      ApiRateLimiter rateLimiter,
                      RetryExecutor retryExecutor,
                      @Qualifier("upstreamRetryPolicy") RetryPolicy retryPolicy,
                      CircuitBreakerRegistry circuitBreakerRegistry) {
        this.api = properties.getApi();
        this.webClient = webClientBuilder.clone().baseUrl(api.getBaseUrl()).build();
        this.rateLimiter = rateLimiter;
        this.retryExecutor = retryExecutor;
        this.retryPolicy = retryPolicy;
        this.circuitBreaker = circuitBreakerRegistry.circuitBreaker(CIRCUIT_BREAKER_NAME);
    }

    /**
     * Poster URL for a TMDB id, empty when the item has no poster or the lookup fails.
     */
    public Mono<String> fetchPosterUrl(TmdbMediaType mediaType, String tmdbId) {
        if (tmdbId == null || tmdbId.isBlank()) {
            return Mono.empty();
        }
        String path = "/" + mediaType.pathSegment() + "/" + tmdbId.trim();
        return get("poster lookup", path, uri -> uri.path(path).build())
            .flatMap(node -> posterUrl(node.path("poster_path")));
    }

    /**
     * Poster URL of the best title match, optionally narrowed by release year.
     */
    public Mono<String> searchPosterUrl(TmdbMediaType mediaType, String title, Integer year) {
        if (title == null || title.isBlank()) {
            return Mono.empty();
        }
        String path = "/search/" + mediaType.pathSegment();
        return get("poster search", path, uri -> {
                uri.path(path).queryParam("query", title.trim());
                if (year != null) {
                    uri.queryParam(mediaType.yearParameter(), year);
                }
                return uri.build();
            })
            .flatMap(node -> {
                JsonNode results = node.path("results");
                if (!results.isArray() || results.isEmpty()) {
                    log.debug("No TMDB {} match for '{}' ({})", mediaType, title, year);
                    return Mono.empty();
                }
                return posterUrl(results.get(0).path("poster_path"));
            });
    }

    private Mono<JsonNode> get(String operation, String path, Function<UriBuilder, URI> uri) {
        if (api.getKey() == null || api.getKey().isBlank()) {
            log.debug("TMDB API key not configured, skipping {}", operation);
            return Mono.empty();
        }
        return retryExecutor.withRetry("tmdb " + operation,
                () -> rateLimiter.waitForQuota(SERVICE_KEY).then(request(path, uri)),
                retryPolicy)
            .transformDeferred(CircuitBreakerOperator.of(circuitBreaker))
            .doOnSuccess(node -> ExternalApiLogger.logApiCallSuccess(log, "TMDB", operation, path))
            .onErrorResume(e -> {
                ExternalApiLogger.logApiCallFailure(log, "TMDB", operation, path, LoggingUtils.rootMessage(e));
                return Mono.empty();
            });
    }

    private Mono<JsonNode> request(String path, Function<UriBuilder, URI> uri) {
        ExternalApiLogger.logHttpRequest(log, "TMDB", "GET", path, true);
        return webClient.get()
            .uri(uri)
            .header(HttpHeaders.AUTHORIZATION, "Bearer " + api.getKey())
            .accept(MediaType.APPLICATION_JSON)
            .retrieve()
            .onStatus(HttpStatusCode::isError, response -> ErrorHandlingUtils.toHttpStatusError(response, "TMDb"))
            .bodyToMono(JsonNode.class)
            .onErrorMap(error -> ErrorHandlingUtils.toNetworkError(error, "TMDb", api.getBaseUrl()));
    }

    private Mono<String> posterUrl(JsonNode posterPath) {
        String value = posterPath.asText(null);
        if (value == null || value.isBlank()) {
            return Mono.empty();
        }
        return Mono.just(api.getImageBaseUrl() + value);
    }
}
