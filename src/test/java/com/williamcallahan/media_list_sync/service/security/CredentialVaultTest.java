package com.williamcallahan.media_list_sync.service.security;

import com.williamcallahan.media_list_sync.config.EncryptionProperties;
import com.williamcallahan.media_list_sync.exception.ConfigurationException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CredentialVaultTest {

    private static final String KEY = "0123456789abcdef0123456789abcdef";

    private CredentialVault vault;

    @BeforeEach
    void setUp() {
        vault = new CredentialVault(KEY);
    }

    @Test
    void encryptThenDecrypt_returnsOriginalPlaintext() {
        EncryptedSecret secret = vault.encrypt("trakt-access-token").orElseThrow();

        assertThat(vault.decrypt(secret)).contains("trakt-access-token");
        assertThat(vault.decrypt(secret.ciphertext(), secret.iv())).contains("trakt-access-token");
    }

    @Test
    void encrypt_producesHexCiphertextAndIv() {
        EncryptedSecret secret = vault.encrypt("token").orElseThrow();

        assertThat(secret.ciphertext()).matches("[0-9a-f]+");
        assertThat(secret.iv()).matches("[0-9a-f]{24}");
        assertThat(secret.ciphertext()).doesNotContain("token");
    }

    @Test
    void encrypt_samePlaintextTwice_usesFreshIv() {
        EncryptedSecret first = vault.encrypt("token").orElseThrow();
        EncryptedSecret second = vault.encrypt("token").orElseThrow();

        assertThat(first.iv()).isNotEqualTo(second.iv());
        assertThat(first.ciphertext()).isNotEqualTo(second.ciphertext());
    }

    @Test
    void encrypt_emptyInput_returnsEmpty() {
        assertThat(vault.encrypt("")).isEmpty();
        assertThat(vault.encrypt(null)).isEmpty();
    }

    @Test
    void decrypt_ivFromAnotherEncryption_returnsEmpty() {
        EncryptedSecret secret = vault.encrypt("token").orElseThrow();
        EncryptedSecret other = vault.encrypt("other").orElseThrow();

        assertThat(vault.decrypt(secret.ciphertext(), other.iv())).isEmpty();
    }

    @Test
    void decrypt_malformedIv_returnsEmpty() {
        EncryptedSecret secret = vault.encrypt("token").orElseThrow();

        assertThat(vault.decrypt(secret.ciphertext(), "zz")).isEmpty();
        assertThat(vault.decrypt(secret.ciphertext(), "abcd")).isEmpty();
    }

    @Test
    void decrypt_tamperedCiphertext_returnsEmpty() {
        EncryptedSecret secret = vault.encrypt("token").orElseThrow();
        char first = secret.ciphertext().charAt(0);
        String tampered = (first == '0' ? '1' : '0') + secret.ciphertext().substring(1);

        assertThat(vault.decrypt(tampered, secret.iv())).isEmpty();
    }

    @Test
    void decrypt_truncatedCiphertext_returnsEmpty() {
        EncryptedSecret secret = vault.encrypt("trakt-access-token").orElseThrow();

        assertThat(vault.decrypt(secret.ciphertext().substring(0, 8), secret.iv())).isEmpty();
        assertThat(vault.decrypt("deadbeef", "000000000000000000000000")).isEmpty();
    }

    @Test
    void decrypt_differentKey_returnsEmpty() {
        EncryptedSecret secret = vault.encrypt("token").orElseThrow();
        CredentialVault otherVault = new CredentialVault("fedcba9876543210fedcba9876543210");

        assertThat(otherVault.decrypt(secret)).isEmpty();
    }

    @Test
    void decrypt_missingFields_returnsEmpty() {
        assertThat(vault.decrypt(null, "00")).isEmpty();
        assertThat(vault.decrypt("00", "")).isEmpty();
        assertThat(vault.decrypt((EncryptedSecret) null)).isEmpty();
    }

    @Test
    void keyBeyondThirtyTwoCharacters_isIgnored() {
        EncryptedSecret secret = vault.encrypt("token").orElseThrow();
        CredentialVault longKeyVault = new CredentialVault(KEY + "-suffix-that-is-not-used");

        assertThat(longKeyVault.decrypt(secret)).contains("token");
    }

    @Test
    void constructor_shortKey_failsWithConfigurationError() {
        assertThatThrownBy(() -> new CredentialVault("too-short"))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("32");
    }

    @Test
    void constructor_missingKey_failsWithConfigurationError() {
        EncryptionProperties properties = new EncryptionProperties();

        assertThatThrownBy(() -> new CredentialVault(properties))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("ENCRYPTION_KEY");
    }

    @Test
    void constructor_fromProperties_usesConfiguredKey() {
        EncryptionProperties properties = new EncryptionProperties();
        properties.setEncryptionKey(KEY);
        EncryptedSecret secret = vault.encrypt("token").orElseThrow();

        assertThat(new CredentialVault(properties).decrypt(secret)).contains("token");
    }
}
