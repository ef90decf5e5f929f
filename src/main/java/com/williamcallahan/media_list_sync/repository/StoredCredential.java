package com.williamcallahan.media_list_sync.repository;

import com.williamcallahan.media_list_sync.service.security.EncryptedSecret;

import java.time.Instant;

/**
 * Persisted credential record for one integration. Tokens are held encrypted; either may be absent.
 */
public record StoredCredential(String integration,
                               EncryptedSecret accessToken,
                               EncryptedSecret refreshToken,
                               Instant expiresAt) {
}
