package com.williamcallahan.media_list_sync.repository;

import com.williamcallahan.media_list_sync.service.security.EncryptedSecret;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

class InMemoryCredentialStoreTest {

    private final InMemoryCredentialStore store = new InMemoryCredentialStore();

    @Test
    void findByIntegration_unknown_isEmpty() {
        assertThat(store.findByIntegration("trakt")).isEmpty();
        assertThat(store.findByIntegration(null)).isEmpty();
    }

    @Test
    void save_replacesPreviousRecord() {
        StoredCredential first = new StoredCredential("trakt", new EncryptedSecret("aa", "01"), null, Instant.EPOCH);
        StoredCredential second = new StoredCredential("trakt", new EncryptedSecret("bb", "02"),
                new EncryptedSecret("cc", "03"), Instant.EPOCH.plusSeconds(60));

        store.save(first);
        store.save(second);

        assertThat(store.findByIntegration("trakt")).contains(second);
    }
}
