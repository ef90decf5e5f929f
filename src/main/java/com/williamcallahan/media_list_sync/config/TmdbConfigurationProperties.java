/**
 * TMDB API configuration properties
 *
 * @author William Callahan
 */

package com.williamcallahan.media_list_sync.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.NestedConfigurationProperty;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "tmdb")
public class TmdbConfigurationProperties {
    @NestedConfigurationProperty
    private Api api = new Api();

    public Api getApi() { return api; }
    public void setApi(Api api) { this.api = api; }

    public static class Api {
        private String baseUrl = "https://api.themoviedb.org/3";
        private String imageBaseUrl = "https://image.tmdb.org/t/p/w500";
        private String key;

        public String getBaseUrl() { return baseUrl; }
        public void setBaseUrl(String baseUrl) { this.baseUrl = baseUrl; }

        public String getImageBaseUrl() { return imageBaseUrl; }
        public void setImageBaseUrl(String imageBaseUrl) { this.imageBaseUrl = imageBaseUrl; }

        public String getKey() { return key; }
        public void setKey(String key) { this.key = key; }
    }
}
