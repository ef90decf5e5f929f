package com.williamcallahan.media_list_sync.config;

import com.williamcallahan.media_list_sync.service.auth.ClientCredentials;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

/**
 * OAuth client registrations keyed by integration name (e.g. {@code trakt}).
 */
@Component
@ConfigurationProperties(prefix = "app.oauth")
public class OAuthClientProperties {

    private Map<String, Client> clients = new HashMap<>();

    public Map<String, Client> getClients() {
        return clients;
    }

    public void setClients(Map<String, Client> clients) {
        this.clients = clients;
    }

    /**
     * Credentials for an integration; an unknown integration yields an unconfigured instance.
     */
    public ClientCredentials credentialsFor(String integration) {
        Client client = integration == null ? null : clients.get(integration.toLowerCase(Locale.ROOT));
        if (client == null) {
            return new ClientCredentials(null, null, null, null);
        }
        return new ClientCredentials(client.getBaseUrl(), client.getClientId(), client.getClientSecret(), client.getRedirectUri());
    }

    public static class Client {
        private String baseUrl;
        private String clientId;
        private String clientSecret;
        private String redirectUri;

        public String getBaseUrl() { return baseUrl; }
        public void setBaseUrl(String baseUrl) { this.baseUrl = baseUrl; }

        public String getClientId() { return clientId; }
        public void setClientId(String clientId) { this.clientId = clientId; }

        public String getClientSecret() { return clientSecret; }
        public void setClientSecret(String clientSecret) { this.clientSecret = clientSecret; }

        public String getRedirectUri() { return redirectUri; }
        public void setRedirectUri(String redirectUri) { this.redirectUri = redirectUri; }
    }
}
