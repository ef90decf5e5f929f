/**
 * Process-local credential store for database-free execution
 *
 * @author William Callahan
 *
 * Features:
 * - Activated by NoDatabaseConfig when no datasource URL is configured
 * - Holds the same encrypted records the JDBC store would persist
 * - Contents are lost on restart
 */
package com.williamcallahan.media_list_sync.repository;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

public class InMemoryCredentialStore implements CredentialStore {

    private static final Logger logger = LoggerFactory.getLogger(InMemoryCredentialStore.class);

    private final Map<String, StoredCredential> credentials = new ConcurrentHashMap<>();

    public InMemoryCredentialStore() {
        logger.info("No database URL provided. Using in-memory credential store; connected integrations will not survive a restart.");
    }

    @Override
    public Optional<StoredCredential> findByIntegration(String integration) {
        if (integration == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(credentials.get(integration));
    }

    @Override
    public void save(StoredCredential credential) {
        credentials.put(credential.integration(), credential);
    }
}
