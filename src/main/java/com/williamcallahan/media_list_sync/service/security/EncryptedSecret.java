package com.williamcallahan.media_list_sync.service.security;

/**
 * Ciphertext and the IV it was produced with, both hex encoded. The pair is only decryptable together.
 */
public record EncryptedSecret(String ciphertext, String iv) {

    @Override
    public String toString() {
        return "EncryptedSecret[ciphertext=<redacted>, iv=" + iv + "]";
    }
}
