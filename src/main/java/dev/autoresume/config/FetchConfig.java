package dev.autoresume.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Retry and cache settings for outbound HTTP calls.
 * Loaded from application.yml under 'fetch' prefix.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "fetch")
public class FetchConfig {

    private int maxRetries = 3;
    private Duration baseDelay = Duration.ofMillis(500);
    private Duration maxDelay = Duration.ofSeconds(10);
    private Duration timeout = Duration.ofSeconds(30);
    private Cache cache = new Cache();

    @Data
    public static class Cache {
        private Duration ttl = Duration.ofHours(24);

        /**
         * "memory" keeps entries for the current run only, "persistent" stores them in SQLite.
         */
        private String store = "persistent";
    }
}
