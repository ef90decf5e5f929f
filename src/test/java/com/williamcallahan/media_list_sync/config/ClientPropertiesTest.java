package com.williamcallahan.media_list_sync.config;

import com.williamcallahan.media_list_sync.service.auth.ClientCredentials;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

class ClientPropertiesTest {

    @Test
    void minIntervalFor_usesServiceEntryOrDefault() {
        RateLimitProperties properties = new RateLimitProperties();
        properties.getServices().put("tmdb", Duration.ofMillis(300));

        assertThat(properties.minIntervalFor("tmdb")).isEqualTo(Duration.ofMillis(300));
        assertThat(properties.minIntervalFor("TMDB")).isEqualTo(Duration.ofMillis(300));
        assertThat(properties.minIntervalFor("mdblist")).isEqualTo(Duration.ofMillis(600));
        assertThat(properties.minIntervalFor(null)).isEqualTo(Duration.ofMillis(600));
    }

    @Test
    void credentialsFor_knownIntegration_isConfigured() {
        OAuthClientProperties properties = new OAuthClientProperties();
        OAuthClientProperties.Client trakt = new OAuthClientProperties.Client();
        trakt.setBaseUrl("https://api.trakt.tv");
        trakt.setClientId("id");
        trakt.setClientSecret("secret");
        properties.getClients().put("trakt", trakt);

        ClientCredentials credentials = properties.credentialsFor("Trakt");

        assertThat(credentials.isConfigured()).isTrue();
        assertThat(credentials.baseUrl()).isEqualTo("https://api.trakt.tv");
        assertThat(credentials.toString()).doesNotContain("secret");
    }

    @Test
    void credentialsFor_missingSecret_isNotConfigured() {
        OAuthClientProperties properties = new OAuthClientProperties();
        OAuthClientProperties.Client trakt = new OAuthClientProperties.Client();
        trakt.setClientId("id");
        properties.getClients().put("trakt", trakt);

        assertThat(properties.credentialsFor("trakt").isConfigured()).isFalse();
        assertThat(properties.credentialsFor("simkl").isConfigured()).isFalse();
    }
}
