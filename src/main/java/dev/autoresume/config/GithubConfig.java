package dev.autoresume.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * GitHub profile collection settings.
 * Loaded from application.yml under 'github' prefix.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "github")
public class GithubConfig {

    private String username;
    private String token;
    private String apiBaseUrl = "https://api.github.com";
    private int parallelism = 4;
    private int perPage = 100;
    private int readmeMaxLength = 3000;
}
