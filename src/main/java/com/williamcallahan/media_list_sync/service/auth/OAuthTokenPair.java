package com.williamcallahan.media_list_sync.service.auth;

import java.time.Instant;

/**
 * Decrypted access/refresh token pair for one integration.
 *
 * @param expiresAt access token expiry; null when unknown
 */
public record OAuthTokenPair(String accessToken, String refreshToken, Instant expiresAt) {

    @Override
    public String toString() {
        return "OAuthTokenPair[accessToken=<redacted>, refreshToken=<redacted>, expiresAt=" + expiresAt + "]";
    }
}
