package com.dqlproxy.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Configuration properties for the DQL proxy.
 */
@Data
@Component
@ConfigurationProperties(prefix = "dqlproxy")
public class DqlProxyProperties {

    private BackendConfig backend = new BackendConfig();
    private AuthConfig auth = new AuthConfig();
    private QueryConfig query = new QueryConfig();
    private CacheConfig cache = new CacheConfig();
    private ShapingConfig shaping = new ShapingConfig();

    @Data
    public static class BackendConfig {
        private String baseUrl = "";
        private String apiToken = "";
        private String executePath = "/api/v2/query:execute";
        private String pollPath = "/api/v2/query:poll";
        private Duration responseTimeout = Duration.ofSeconds(30);

        /**
         * Both the base URL and the API token are needed to reach Grail.
         */
        public boolean isConfigured() {
            return baseUrl != null && !baseUrl.isBlank()
                    && apiToken != null && !apiToken.isBlank();
        }

        /**
         * Base URL without trailing slashes.
         */
        public String normalizedBaseUrl() {
            String url = baseUrl == null ? "" : baseUrl.trim();
            while (url.endsWith("/")) {
                url = url.substring(0, url.length() - 1);
            }
            return url;
        }
    }

    @Data
    public static class AuthConfig {
        /**
         * Bearer token clients must present. Empty disables proxy authentication.
         */
        private String orgBearer = "";

        public boolean isEnabled() {
            return orgBearer != null && !orgBearer.isBlank();
        }
    }

    @Data
    public static class QueryConfig {
        private Duration timeout = Duration.ofSeconds(30);
        private Duration initialBackoff = Duration.ofMillis(250);
        private Duration maxBackoff = Duration.ofSeconds(1);
    }

    @Data
    public static class CacheConfig {
        private int maxItems = 512;
        private Duration rawTtl = Duration.ofSeconds(15);
        private Duration defaultTtl = Duration.ofSeconds(30);
    }

    @Data
    public static class ShapingConfig {
        /**
         * Prepended to the "table" and "timeseries" schema tags, e.g. "grafana-".
         */
        private String schemaPrefix = "";
    }
}
