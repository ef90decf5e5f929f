package com.williamcallahan.media_list_sync.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Secret material for encrypting stored credentials.
 */
@Component
@ConfigurationProperties(prefix = "app.security")
public class EncryptionProperties {

    /**
     * Symmetric key source, at least 32 characters. Bound from {@code ENCRYPTION_KEY}.
     */
    private String encryptionKey;

    public String getEncryptionKey() {
        return encryptionKey;
    }

    public void setEncryptionKey(String encryptionKey) {
        this.encryptionKey = encryptionKey;
    }
}
