package com.williamcallahan.media_list_sync.repository;

import java.util.Optional;

/**
 * Storage collaborator for OAuth credentials. Implementations are blocking; callers shift them
 * onto a bounded elastic scheduler.
 */
public interface CredentialStore {

    Optional<StoredCredential> findByIntegration(String integration);

    /**
     * Insert or replace the record for {@code credential.integration()}.
     */
    void save(StoredCredential credential);
}
