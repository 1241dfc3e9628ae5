package dev.autoresume.source.github;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.autoresume.config.GithubConfig;
import dev.autoresume.exception.CollectionException;
import dev.autoresume.exception.FetchException;
import dev.autoresume.exception.RateLimitedException;
import dev.autoresume.fetch.FetchRequest;
import dev.autoresume.fetch.FetchResponse;
import dev.autoresume.fetch.ResilientFetcher;
import dev.autoresume.metrics.PipelineMetrics;
import dev.autoresume.model.Repository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.Comparator;
import java.util.List;
import java.util.Map;

/**
 * Collects a user's public repositories with languages, README excerpt and
 * commit count. Detail calls run on a bounded number of concurrent requests.
 */
@Slf4j
@Component
public class GithubCollector {

    private static final String ACCEPT_JSON = "application/vnd.github+json";
    private static final String ACCEPT_RAW = "application/vnd.github.raw+json";

    private final ResilientFetcher fetcher;
    private final ObjectMapper objectMapper;
    private final GithubConfig githubConfig;
    private final PipelineMetrics metrics;
    private final Clock clock;

    public GithubCollector(ResilientFetcher fetcher, ObjectMapper objectMapper, GithubConfig githubConfig,
                           PipelineMetrics metrics, Clock clock) {
        this.fetcher = fetcher;
        this.objectMapper = objectMapper;
        this.githubConfig = githubConfig;
        this.metrics = metrics;
        this.clock = clock;
    }

    /**
     * Collect every public repository of a user. The result always holds one
     * entry per listed repository; missing details degrade to empty fields.
     * Rate limiting is never degraded: it fails the whole collection.
     */
    public Mono<List<Repository>> collect(String username, String token) {
        if (username == null || username.isBlank()) {
            return Mono.error(new CollectionException("GitHub username is not configured (github.username)"));
        }
        log.info("Collecting repositories for GitHub user {} ({})", username,
                token == null || token.isBlank() ? "unauthenticated" : "authenticated");

        return listRepositories(username, token)
                .flatMap(listed -> checkBudget(listed, token).thenReturn(listed))
                .flatMapMany(Flux::fromIterable)
                .flatMap(listed -> enrich(listed, token), Math.max(1, githubConfig.getParallelism()))
                .collectList()
                .map(repositories -> repositories.stream()
                        .sorted(Comparator.comparingLong(Repository::importanceScore).reversed()
                                .thenComparing(Repository::name))
                        .toList())
                .doOnSuccess(repositories -> {
                    metrics.recordRepositoriesCollected(repositories.size());
                    log.info("Collected {} repositories for {}", repositories.size(), username);
                })
                .onErrorMap(e -> !(e instanceof RateLimitedException) && !(e instanceof CollectionException),
                        e -> new CollectionException("Could not collect repositories for " + username + ": "
                                + e.getMessage(), e));
    }

    protected String apiUrl(String path) {
        String base = githubConfig.getApiBaseUrl();
        if (base.endsWith("/")) {
            base = base.substring(0, base.length() - 1);
        }
        return base + path;
    }

    private Mono<List<ListedRepository>> listRepositories(String username, String token) {
        return fetchPage(username, token, 1)
                .expand(page -> page.repositories().size() >= githubConfig.getPerPage()
                        ? fetchPage(username, token, page.number() + 1)
                        : Mono.empty())
                .flatMapIterable(Page::repositories)
                .collectList()
                .doOnNext(listed -> log.info("Listed {} public repositories", listed.size()))
                .onErrorMap(e -> e instanceof FetchException fetchException && fetchException.isNotFound(),
                        e -> new CollectionException("GitHub user not found: " + username, e));
    }

    private Mono<Page> fetchPage(String username, String token, int number) {
        String url = apiUrl(String.format("/users/%s/repos?per_page=%d&page=%d&sort=pushed",
                username, githubConfig.getPerPage(), number));
        return fetcher.fetch(request(url, token, ACCEPT_JSON))
                .map(response -> new Page(number, decode(response, new TypeReference<List<ListedRepository>>() {
                })));
    }

    /**
     * Fail early when the remaining API budget cannot cover the detail calls
     * still needed. Calls already answered by the cache cost nothing.
     */
    private Mono<Void> checkBudget(List<ListedRepository> listed, String token) {
        return Mono.fromCallable(() -> listed.stream()
                        .flatMap(repo -> detailRequests(repo, token).stream())
                        .filter(detail -> !fetcher.isCached(detail))
                        .count())
                .subscribeOn(Schedulers.boundedElastic())
                .flatMap(required -> required == 0 ? Mono.<Void>empty() : verifyBudget(required, token));
    }

    private Mono<Void> verifyBudget(long required, String token) {
        return fetcher.fetch(request(apiUrl("/rate_limit"), token, ACCEPT_JSON).uncached())
                .flatMap(response -> {
                    JsonNode core = decode(response, JsonNode.class).path("resources").path("core");
                    long remaining = core.path("remaining").asLong(Long.MAX_VALUE);
                    if (remaining >= required) {
                        log.debug("Rate limit budget ok: {} remaining, {} required", remaining, required);
                        return Mono.<Void>empty();
                    }
                    Duration retryAfter = Duration.between(clock.instant(),
                            Instant.ofEpochSecond(core.path("reset").asLong(clock.instant().getEpochSecond())));
                    return Mono.<Void>error(new RateLimitedException(String.format(
                            "GitHub rate limit too low: %d requests remaining, %d needed%s",
                            remaining, required, token != null && !token.isBlank() ? "" : " (set github.token to raise the limit)"),
                            0, retryAfter.isNegative() ? Duration.ZERO : retryAfter));
                })
                .onErrorResume(e -> !(e instanceof RateLimitedException), e -> {
                    log.warn("Could not read GitHub rate limit, continuing without budget check: {}", e.getMessage());
                    return Mono.empty();
                });
    }

    private List<FetchRequest> detailRequests(ListedRepository repo, String token) {
        return List.of(languagesRequest(repo, token), readmeRequest(repo, token), contributorsRequest(repo, token));
    }

    private FetchRequest languagesRequest(ListedRepository repo, String token) {
        return request(apiUrl("/repos/" + repo.fullName() + "/languages"), token, ACCEPT_JSON);
    }

    private FetchRequest readmeRequest(ListedRepository repo, String token) {
        return request(apiUrl("/repos/" + repo.fullName() + "/readme"), token, ACCEPT_RAW);
    }

    private FetchRequest contributorsRequest(ListedRepository repo, String token) {
        return request(apiUrl("/repos/" + repo.fullName() + "/contributors?per_page=100"), token, ACCEPT_JSON);
    }

    private Mono<Repository> enrich(ListedRepository listed, String token) {
        Mono<Map<String, Long>> languages = soft(
                fetcher.fetch(languagesRequest(listed, token))
                        .map(response -> decode(response, new TypeReference<Map<String, Long>>() {
                        })),
                Map.of(), "languages", listed);

        Mono<String> readme = soft(
                fetcher.fetch(readmeRequest(listed, token)).map(FetchResponse::bodyAsString),
                "", "README", listed);

        Mono<Long> commits = soft(
                fetcher.fetch(contributorsRequest(listed, token)).map(this::sumContributions),
                0L, "commit activity", listed);

        return Mono.zip(languages, readme, commits)
                .map(details -> Repository.builder()
                        .name(listed.name())
                        .url(listed.htmlUrl())
                        .description(listed.description())
                        .stars(listed.stargazersCount())
                        .forks(listed.forksCount())
                        .primaryLanguage(listed.language())
                        .languageBreakdown(details.getT1())
                        .readmeExcerpt(excerpt(details.getT2()))
                        .lastActivity(parseInstant(listed.pushedAt()))
                        .createdAt(parseInstant(listed.createdAt()))
                        .commitCount(details.getT3())
                        .sizeKb(listed.size())
                        .fork(listed.fork())
                        .archived(listed.archived())
                        .build());
    }

    private <T> Mono<T> soft(Mono<T> call, T fallback, String what, ListedRepository repo) {
        return call.onErrorResume(e -> !(e instanceof RateLimitedException), e -> {
            if (e instanceof FetchException fetchException && fetchException.isNotFound()) {
                log.debug("{} has no {}", repo.fullName(), what);
            } else {
                log.warn("Could not fetch {} for {}: {}", what, repo.fullName(), e.getMessage());
            }
            return Mono.just(fallback);
        });
    }

    private long sumContributions(FetchResponse response) {
        if (response.body().length == 0) {
            return 0L;
        }
        JsonNode contributors = decode(response, JsonNode.class);
        long total = 0;
        for (JsonNode contributor : contributors) {
            total += contributor.path("contributions").asLong(0);
        }
        return total;
    }

    private String excerpt(String readme) {
        String trimmed = readme.strip();
        int max = githubConfig.getReadmeMaxLength();
        return trimmed.length() > max ? trimmed.substring(0, max) + "..." : trimmed;
    }

    private FetchRequest request(String url, String token, String accept) {
        FetchRequest request = FetchRequest.get(url)
                .withHeader("Accept", accept)
                .withHeader("X-GitHub-Api-Version", "2022-11-28");
        if (token != null && !token.isBlank()) {
            request = request.withHeader("Authorization", "Bearer " + token);
        }
        return request;
    }

    private <T> T decode(FetchResponse response, Class<T> type) {
        try {
            return objectMapper.readValue(response.body(), type);
        } catch (IOException e) {
            throw new FetchException("Malformed GitHub response: " + e.getMessage(), 0, false);
        }
    }

    private <T> T decode(FetchResponse response, TypeReference<T> type) {
        try {
            return objectMapper.readValue(response.body(), type);
        } catch (IOException e) {
            throw new FetchException("Malformed GitHub response: " + e.getMessage(), 0, false);
        }
    }

    private static Instant parseInstant(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return Instant.parse(value);
        } catch (DateTimeParseException e) {
            log.debug("Unparseable timestamp '{}'", value);
            return null;
        }
    }

    private record Page(int number, List<ListedRepository> repositories) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record ListedRepository(
            @JsonProperty("name") String name,
            @JsonProperty("full_name") String fullName,
            @JsonProperty("html_url") String htmlUrl,
            @JsonProperty("description") String description,
            @JsonProperty("stargazers_count") long stargazersCount,
            @JsonProperty("forks_count") long forksCount,
            @JsonProperty("language") String language,
            @JsonProperty("pushed_at") String pushedAt,
            @JsonProperty("created_at") String createdAt,
            @JsonProperty("size") long size,
            @JsonProperty("fork") boolean fork,
            @JsonProperty("archived") boolean archived) {
    }
}
