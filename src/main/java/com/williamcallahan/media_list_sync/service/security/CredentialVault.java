/**
 * Symmetric encryption for secrets stored at rest
 *
 * @author William Callahan
 *
 * Features:
 * - AES-256 in GCM mode with a fresh random 12-byte IV per encryption
 * - Key derived from the configured secret, truncated to the 32 bytes AES-256 needs
 * - Hex encoding for ciphertext and IV so both fit plain text columns
 * - Decryption failures (tampering, wrong key, malformed IV) yield an empty result instead of an exception
 */

package com.williamcallahan.media_list_sync.service.security;

import com.williamcallahan.media_list_sync.config.EncryptionProperties;
import com.williamcallahan.media_list_sync.exception.ConfigurationException;
import com.williamcallahan.media_list_sync.util.LoggingUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import javax.crypto.Cipher;
import javax.crypto.spec.GCMParameterSpec;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.ProviderException;
import java.security.SecureRandom;
import java.util.Arrays;
import java.util.HexFormat;
import java.util.Optional;

@Service
public class CredentialVault {

    private static final Logger logger = LoggerFactory.getLogger(CredentialVault.class);

    static final int MIN_KEY_LENGTH = 32;
    private static final String ALGORITHM = "AES";
    private static final String TRANSFORMATION = "AES/GCM/NoPadding";
    private static final int KEY_BYTES = 32;
    private static final int IV_BYTES = 12;
    private static final int TAG_BITS = 128;
    private static final HexFormat HEX = HexFormat.of();

    private final SecretKeySpec key;
    private final SecureRandom secureRandom = new SecureRandom();

    public CredentialVault(EncryptionProperties properties) {
        this(properties.getEncryptionKey());
    }

    CredentialVault(String encryptionKey) {
        this.key = deriveKey(encryptionKey);
    }

    /**
     * Encrypts {@code plaintext} under a new random IV.
     *
     * @return the ciphertext/IV pair, or empty when the input is null or empty
     */
    public Optional<EncryptedSecret> encrypt(String plaintext) {
        if (plaintext == null || plaintext.isEmpty()) {
            return Optional.empty();
        }
        byte[] iv = new byte[IV_BYTES];
        secureRandom.nextBytes(iv);
        try {
            Cipher cipher = Cipher.getInstance(TRANSFORMATION);
            cipher.init(Cipher.ENCRYPT_MODE, key, new GCMParameterSpec(TAG_BITS, iv));
            byte[] encrypted = cipher.doFinal(plaintext.getBytes(StandardCharsets.UTF_8));
            return Optional.of(new EncryptedSecret(HEX.formatHex(encrypted), HEX.formatHex(iv)));
        } catch (GeneralSecurityException e) {
            // AES/GCM is mandatory on every JDK, so this only happens on a broken provider setup
            throw new IllegalStateException("Unable to encrypt secret", e);
        }
    }

    /**
     * Decrypts a ciphertext produced by {@link #encrypt(String)} with the IV from the same call.
     *
     * @return the plaintext, or empty when either field is missing or the pair does not decrypt
     */
    public Optional<String> decrypt(String ciphertext, String iv) {
        if (ciphertext == null || ciphertext.isEmpty() || iv == null || iv.isEmpty()) {
            return Optional.empty();
        }
        try {
            byte[] ivBytes = HEX.parseHex(iv);
            if (ivBytes.length != IV_BYTES) {
                logger.warn("Decryption failed: IV has {} bytes, expected {}", ivBytes.length, IV_BYTES);
                return Optional.empty();
            }
            byte[] encrypted = HEX.parseHex(ciphertext);
            if (encrypted.length < TAG_BITS / 8) {
                logger.warn("Decryption failed: ciphertext has {} bytes, shorter than the authentication tag", encrypted.length);
                return Optional.empty();
            }
            Cipher cipher = Cipher.getInstance(TRANSFORMATION);
            cipher.init(Cipher.DECRYPT_MODE, key, new GCMParameterSpec(TAG_BITS, ivBytes));
            byte[] decrypted = cipher.doFinal(encrypted);
            return Optional.of(new String(decrypted, StandardCharsets.UTF_8));
        } catch (GeneralSecurityException | IllegalArgumentException | ProviderException e) {
            LoggingUtils.warn(logger, null, "Decryption failed: {}", e.getClass().getSimpleName());
            return Optional.empty();
        }
    }

    public Optional<String> decrypt(EncryptedSecret secret) {
        if (secret == null) {
            return Optional.empty();
        }
        return decrypt(secret.ciphertext(), secret.iv());
    }

    private static SecretKeySpec deriveKey(String encryptionKey) {
        if (encryptionKey == null || encryptionKey.isBlank()) {
            throw new ConfigurationException("ENCRYPTION_KEY environment variable is required");
        }
        if (encryptionKey.length() < MIN_KEY_LENGTH) {
            throw new ConfigurationException("ENCRYPTION_KEY must be at least " + MIN_KEY_LENGTH + " characters");
        }
        byte[] raw = encryptionKey.substring(0, MIN_KEY_LENGTH).getBytes(StandardCharsets.UTF_8);
        return new SecretKeySpec(Arrays.copyOf(raw, KEY_BYTES), ALGORITHM);
    }
}
