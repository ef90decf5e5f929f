package com.williamcallahan.media_list_sync.repository;

import com.williamcallahan.media_list_sync.service.security.EncryptedSecret;
import org.springframework.boot.autoconfigure.condition.ConditionalOnExpression;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.util.List;
import java.util.Optional;

/**
 * Postgres-backed credential store over the {@code integration_credentials} table.
 * Token columns hold hex ciphertext with a matching {@code *_iv} column.
 */
@Repository
@ConditionalOnExpression("'${spring.datasource.url:}'.length() > 0")
public class JdbcCredentialStore implements CredentialStore {

    private static final String SELECT_SQL = """
            SELECT integration, access_token, access_token_iv, refresh_token, refresh_token_iv, expires_at
            FROM integration_credentials
            WHERE integration = ?
            """;

    private static final String UPSERT_SQL = """
            INSERT INTO integration_credentials
                (integration, access_token, access_token_iv, refresh_token, refresh_token_iv, expires_at, updated_at)
            VALUES (?, ?, ?, ?, ?, ?, now())
            ON CONFLICT (integration) DO UPDATE SET
                access_token = EXCLUDED.access_token,
                access_token_iv = EXCLUDED.access_token_iv,
                refresh_token = EXCLUDED.refresh_token,
                refresh_token_iv = EXCLUDED.refresh_token_iv,
                expires_at = EXCLUDED.expires_at,
                updated_at = now()
            """;

    private static final RowMapper<StoredCredential> ROW_MAPPER = JdbcCredentialStore::mapRow;

    private final JdbcTemplate jdbcTemplate;

    public JdbcCredentialStore(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Override
    public Optional<StoredCredential> findByIntegration(String integration) {
        List<StoredCredential> rows = jdbcTemplate.query(SELECT_SQL, ROW_MAPPER, integration);
        return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
    }

    @Override
    public void save(StoredCredential credential) {
        EncryptedSecret access = credential.accessToken();
        EncryptedSecret refresh = credential.refreshToken();
        jdbcTemplate.update(UPSERT_SQL,
                credential.integration(),
                access != null ? access.ciphertext() : null,
                access != null ? access.iv() : null,
                refresh != null ? refresh.ciphertext() : null,
                refresh != null ? refresh.iv() : null,
                credential.expiresAt() != null ? Timestamp.from(credential.expiresAt()) : null);
    }

    private static StoredCredential mapRow(ResultSet rs, int rowNum) throws SQLException {
        Timestamp expiresAt = rs.getTimestamp("expires_at");
        return new StoredCredential(
                rs.getString("integration"),
                secret(rs.getString("access_token"), rs.getString("access_token_iv")),
                secret(rs.getString("refresh_token"), rs.getString("refresh_token_iv")),
                expiresAt != null ? expiresAt.toInstant() : null);
    }

    private static EncryptedSecret secret(String ciphertext, String iv) {
        if (ciphertext == null) {
            return null;
        }
        return new EncryptedSecret(ciphertext, iv);
    }
}
