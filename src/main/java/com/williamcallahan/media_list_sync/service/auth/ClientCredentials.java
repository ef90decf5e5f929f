package com.williamcallahan.media_list_sync.service.auth;

/**
 * OAuth client registration used for refresh grants.
 *
 * @param baseUrl authorization server base, {@code /oauth/token} is appended
 */
public record ClientCredentials(String baseUrl, String clientId, String clientSecret, String redirectUri) {

    public boolean isConfigured() {
        return hasText(clientId) && hasText(clientSecret);
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }

    @Override
    public String toString() {
        return "ClientCredentials[baseUrl=" + baseUrl + ", clientId=" + clientId + ", clientSecret=<redacted>]";
    }
}
