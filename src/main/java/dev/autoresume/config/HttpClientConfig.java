package dev.autoresume.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;

import java.time.Clock;
import java.util.Objects;

/**
 * The single HTTP client shared by every collaborator that talks to the network.
 */
@Configuration
public class HttpClientConfig {

    private static final String USER_AGENT = "auto-resume";

    @Bean
    public WebClient sharedWebClient(WebClient.Builder webClientBuilder) {
        HttpClient httpClient = HttpClient.create()
                .followRedirect(true)
                .httpResponseDecoder(spec -> spec.maxHeaderSize(32768));

        return webClientBuilder
                .codecs(config -> config.defaultCodecs().maxInMemorySize(10 * 1024 * 1024))
                .clientConnector(new ReactorClientHttpConnector(Objects.requireNonNull(httpClient)))
                .defaultHeader("User-Agent", USER_AGENT)
                .build();
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
