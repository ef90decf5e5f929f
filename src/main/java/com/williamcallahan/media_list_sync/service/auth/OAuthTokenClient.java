/**
 * HTTP client for the OAuth {@code refresh_token} grant
 *
 * @author William Callahan
 */
package com.williamcallahan.media_list_sync.service.auth;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.williamcallahan.media_list_sync.util.ErrorHandlingUtils;
import com.williamcallahan.media_list_sync.util.ExternalApiLogger;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

@Component
@Slf4j
public class OAuthTokenClient {

    static final String TOKEN_PATH = "/oauth/token";
    private static final Duration REQUEST_TIMEOUT = Duration.ofSeconds(15);

    private final WebClient webClient;

    public OAuthTokenClient(WebClient.Builder webClientBuilder) {
        this.webClient = webClientBuilder.build();
    }

    /**
     * Exchanges {@code refreshToken} for a new token pair.
     * Transport failures surface as {@code NetworkException}, non-2xx answers as {@code HttpStatusException}.
     */
    public Mono<TokenResponse> refresh(String refreshToken, ClientCredentials credentials) {
        Map<String, String> body = new LinkedHashMap<>();
        body.put("refresh_token", refreshToken);
        body.put("client_id", credentials.clientId());
        body.put("client_secret", credentials.clientSecret());
        body.put("redirect_uri", credentials.redirectUri());
        body.put("grant_type", "refresh_token");

        String baseUrl = credentials.baseUrl();
        ExternalApiLogger.logHttpRequest(log, "OAuth", "POST", TOKEN_PATH, false);
        return webClient.post()
                .uri(baseUrl + TOKEN_PATH)
                .contentType(MediaType.APPLICATION_JSON)
                .accept(MediaType.APPLICATION_JSON)
                .bodyValue(body)
                .retrieve()
                .onStatus(HttpStatusCode::isError, response -> ErrorHandlingUtils.toHttpStatusError(response, "OAuth token"))
                .bodyToMono(TokenResponse.class)
                .timeout(REQUEST_TIMEOUT)
                .onErrorMap(error -> ErrorHandlingUtils.toNetworkError(error, "OAuth", baseUrl));
    }

    /**
     * Success body of the token endpoint.
     *
     * @param expiresIn access token lifetime in seconds, null when the server omitted it
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record TokenResponse(@JsonProperty("access_token") String accessToken,
                                @JsonProperty("refresh_token") String refreshToken,
                                @JsonProperty("expires_in") Long expiresIn) {

        @Override
        public String toString() {
            return "TokenResponse[expiresIn=" + expiresIn + "]";
        }
    }
}
