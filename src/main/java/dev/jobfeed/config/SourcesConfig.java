package dev.jobfeed.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Connection settings for each job source.
 * Loaded from application.yml under 'sources' prefix.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "sources")
public class SourcesConfig {

    private Provider jsearch = new Provider();
    private Provider careerjet = new Provider();
    private Provider serpapi = new Provider();

    @Data
    public static class Provider {
        private boolean enabled = true;
        private String baseUrl;
        private String apiKey;
        private String locale = "en_US";

        // Pause before every request, keeps us under provider rate limits
        private Duration requestDelay = Duration.ofSeconds(1);
        private Duration timeout = Duration.ofSeconds(30);

        // Extra attempts on HTTP 429 before the page is reported unavailable
        private int rateLimitRetries = 2;
        private Duration rateLimitBackoff = Duration.ofSeconds(2);

        public boolean hasApiKey() {
            return apiKey != null && !apiKey.isBlank();
        }
    }
}
