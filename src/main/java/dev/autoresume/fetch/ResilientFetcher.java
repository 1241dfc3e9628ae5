package dev.autoresume.fetch;

import dev.autoresume.config.FetchConfig;
import dev.autoresume.exception.FetchException;
import dev.autoresume.exception.RateLimitedException;
import dev.autoresume.metrics.PipelineMetrics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Single choke point for network reads: cache lookup, then the call wrapped
 * in bounded exponential backoff, then a cache write on success.
 */
@Slf4j
@Component
public class ResilientFetcher {

    private static final int MAX_ERROR_DETAIL = 300;

    private final WebClient webClient;
    private final ResponseCache cache;
    private final PipelineMetrics metrics;
    private final Clock clock;
    private final BackoffPolicy backoffPolicy;
    private final Duration timeout;
    private final Duration ttl;

    public ResilientFetcher(WebClient sharedWebClient, ResponseCache cache, PipelineMetrics metrics,
                            Clock clock, FetchConfig fetchConfig) {
        this.webClient = sharedWebClient;
        this.cache = cache;
        this.metrics = metrics;
        this.clock = clock;
        this.timeout = fetchConfig.getTimeout();
        this.ttl = fetchConfig.getCache().getTtl();
        this.backoffPolicy = new BackoffPolicy(fetchConfig.getMaxRetries(), fetchConfig.getBaseDelay(),
                fetchConfig.getMaxDelay(), ResilientFetcher::isRetryable);
    }

    /**
     * Fetch a resource, serving it from the cache when a live entry exists.
     */
    public Mono<FetchResponse> fetch(FetchRequest request) {
        if (!request.cacheable()) {
            return fetchFromNetwork(request);
        }
        String key = request.cacheKey();
        return Mono.fromCallable(() -> cache.get(key))
                .subscribeOn(Schedulers.boundedElastic())
                .flatMap(Mono::justOrEmpty)
                .map(FetchResponse::cached)
                .doOnNext(hit -> {
                    metrics.recordCacheHit();
                    log.debug("Cache hit for {} {}", request.method(), request.url());
                })
                .switchIfEmpty(Mono.defer(() -> {
                    metrics.recordCacheMiss();
                    return fetchFromNetwork(request)
                            .flatMap(response -> store(key, response).thenReturn(response));
                }));
    }

    /**
     * Whether a live cache entry exists, i.e. fetching would not cost a network call.
     */
    public boolean isCached(FetchRequest request) {
        return request.cacheable() && cache.containsLive(request.cacheKey());
    }

    private Mono<FetchResponse> fetchFromNetwork(FetchRequest request) {
        return Mono.defer(() -> send(request))
                .retryWhen(backoffPolicy.toRetry(signal -> {
                    metrics.recordRetry("fetch");
                    log.info("Retrying {} (attempt {}): {}", request.url(),
                            signal.totalRetries() + 1, signal.failure().getMessage());
                }));
    }

    @SuppressWarnings("null")
    private Mono<FetchResponse> send(FetchRequest request) {
        long start = System.currentTimeMillis();
        return webClient.method(request.method())
                .uri(URI.create(request.url()))
                .headers(headers -> request.headers().forEach(headers::set))
                .exchangeToMono(response -> response.bodyToMono(byte[].class)
                        .defaultIfEmpty(new byte[0])
                        .flatMap(body -> toResult(request, response, body)))
                .timeout(timeout)
                .doOnSubscribe(subscription -> metrics.recordNetworkCall())
                .doOnTerminate(() -> log.debug("{} {} took {} ms", request.method(), request.url(),
                        System.currentTimeMillis() - start))
                .onErrorMap(e -> !(e instanceof FetchException),
                        e -> new FetchException("Request to " + request.url() + " failed: " + e.getMessage(), e));
    }

    private Mono<FetchResponse> toResult(FetchRequest request, ClientResponse response, byte[] body) {
        int status = response.statusCode().value();
        Map<String, String> headers = flattenHeaders(response.headers().asHttpHeaders());
        if (response.statusCode().is2xxSuccessful()) {
            return Mono.just(new FetchResponse(status, body, headers, false));
        }
        return Mono.error(classify(request, status, headers, body));
    }

    private FetchException classify(FetchRequest request, int status, Map<String, String> headers, byte[] body) {
        String detail = new String(body, StandardCharsets.UTF_8);
        if (detail.length() > MAX_ERROR_DETAIL) {
            detail = detail.substring(0, MAX_ERROR_DETAIL) + "...";
        }
        String message = "HTTP " + status + " from " + request.url() + (detail.isBlank() ? "" : ": " + detail);

        if (status == 429 || (status == 403 && "0".equals(headers.get("x-ratelimit-remaining")))) {
            return new RateLimitedException(message, status, retryAfter(headers));
        }
        boolean retryable = status >= 500 || status == 408;
        return new FetchException(message, status, retryable);
    }

    /**
     * Hint from Retry-After (seconds) or X-RateLimit-Reset (epoch seconds).
     */
    private Duration retryAfter(Map<String, String> headers) {
        try {
            String retryAfter = headers.get("retry-after");
            if (retryAfter != null) {
                return Duration.ofSeconds(Long.parseLong(retryAfter.trim()));
            }
            String reset = headers.get("x-ratelimit-reset");
            if (reset != null) {
                Duration untilReset = Duration.between(clock.instant(), Instant.ofEpochSecond(Long.parseLong(reset.trim())));
                return untilReset.isNegative() ? Duration.ZERO : untilReset;
            }
        } catch (NumberFormatException e) {
            log.debug("Unparseable rate limit header: {}", e.getMessage());
        }
        return Duration.ZERO;
    }

    private Mono<Void> store(String key, FetchResponse response) {
        return Mono.fromRunnable(() -> cache.put(new CacheEntry(key, response.body(), clock.instant(), ttl)))
                .subscribeOn(Schedulers.boundedElastic())
                .then();
    }

    private static Map<String, String> flattenHeaders(HttpHeaders httpHeaders) {
        Map<String, String> flat = new HashMap<>();
        httpHeaders.forEach((name, values) -> Optional.ofNullable(values)
                .filter(v -> !v.isEmpty())
                .ifPresent(v -> flat.put(name.toLowerCase(Locale.ROOT), v.get(0))));
        return flat;
    }

    private static boolean isRetryable(Throwable e) {
        return e instanceof FetchException fetchException && fetchException.isRetryable();
    }
}
