package com.williamcallahan.media_list_sync.config;

import com.williamcallahan.media_list_sync.repository.CredentialStore;
import com.williamcallahan.media_list_sync.repository.InMemoryCredentialStore;
import org.springframework.boot.autoconfigure.EnableAutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnExpression;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;
import org.springframework.boot.autoconfigure.jdbc.DataSourceTransactionManagerAutoConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration to disable database components in absence of a database URL
 *
 * @author William Callahan
 *
 * Features:
 * - Activates only when no database URL is configured in properties
 * - Disables Spring's datasource auto-configuration
 * - Supplies an in-memory credential store in place of the JDBC one
 */
@Configuration
@ConditionalOnExpression("'${spring.datasource.url:}'.length() == 0")
@EnableAutoConfiguration(exclude = {
        DataSourceAutoConfiguration.class,
        DataSourceTransactionManagerAutoConfiguration.class
})
public class NoDatabaseConfig {

    @Bean
    public CredentialStore credentialStore() {
        return new InMemoryCredentialStore();
    }
}
