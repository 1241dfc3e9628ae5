package dev.autoresume.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Generative provider settings.
 * Loaded from application.yml under 'llm' prefix.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "llm")
public class LlmConfig {

    private String provider = "gemini";
    private String apiKey;

    /**
     * Model name; each provider falls back to its own default when unset.
     */
    private String model;

    /**
     * API root; each provider falls back to its public endpoint when unset.
     */
    private String baseUrl;
    private int maxRetries = 3;
    private double temperature = 0.3;
    private Duration timeout = Duration.ofSeconds(120);
}
