package dev.autoresume.source;

import dev.autoresume.exception.ResolutionException;
import dev.autoresume.exception.ResolutionException.Reason;
import dev.autoresume.fetch.FetchRequest;
import dev.autoresume.fetch.ResilientFetcher;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.springframework.core.io.ClassPathResource;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;

/**
 * Obtains the raw job posting text from a URL, a local file, or the built-in
 * generic template when neither is given.
 */
@Slf4j
@Component
public class JobSourceResolver {

    private static final String DEFAULT_TEMPLATE = "job-template.txt";
    private static final String BROWSER_USER_AGENT =
            "Mozilla/5.0 (Windows NT 10.0; Win64; x64) AppleWebKit/537.36 (KHTML, like Gecko) Chrome/120.0.0.0 Safari/537.36";

    private final ResilientFetcher fetcher;
    private final String defaultTemplate;

    public JobSourceResolver(ResilientFetcher fetcher) {
        this.fetcher = fetcher;
        this.defaultTemplate = loadDefaultTemplate();
    }

    /**
     * Resolve the posting text. Supplying both a URL and a file is rejected as ambiguous.
     */
    public Mono<String> resolve(String url, String file) {
        boolean hasUrl = url != null && !url.isBlank();
        boolean hasFile = file != null && !file.isBlank();

        if (hasUrl && hasFile) {
            return Mono.error(new ResolutionException(Reason.AMBIGUOUS,
                    "Both a job URL and a job file were given; use only one"));
        }
        if (hasUrl) {
            return fromUrl(url.trim());
        }
        if (hasFile) {
            return fromFile(Path.of(file.trim()));
        }
        log.info("No job posting supplied, using the generic template");
        return Mono.just(defaultTemplate);
    }

    public String getDefaultTemplate() {
        return defaultTemplate;
    }

    private Mono<String> fromUrl(String url) {
        log.info("Fetching job description from: {}", url);
        FetchRequest request = FetchRequest.get(url)
                .withHeader("User-Agent", BROWSER_USER_AGENT)
                .withHeader("Accept", "text/html,application/xhtml+xml,text/plain;q=0.9,*/*;q=0.8");

        return fetcher.fetch(request)
                .map(response -> extractVisibleText(response.bodyAsString(), url))
                .doOnNext(text -> log.debug("Extracted {} characters of job text", text.length()))
                .onErrorMap(e -> !(e instanceof ResolutionException),
                        e -> new ResolutionException(Reason.FETCH_FAILED,
                                "Could not fetch job posting " + url + ": " + e.getMessage(), e));
    }

    private Mono<String> fromFile(Path path) {
        log.info("Reading job description from file: {}", path);
        return Mono.fromCallable(() -> readFile(path))
                .subscribeOn(Schedulers.boundedElastic());
    }

    private String readFile(Path path) {
        try {
            String content = Files.readString(path, StandardCharsets.UTF_8);
            if (content.isBlank()) {
                throw new ResolutionException(Reason.IO_ERROR, "Job file " + path + " is empty");
            }
            return content;
        } catch (NoSuchFileException e) {
            throw new ResolutionException(Reason.NOT_FOUND, "Job file not found: " + path, e);
        } catch (IOException e) {
            throw new ResolutionException(Reason.IO_ERROR, "Could not read job file " + path + ": " + e.getMessage(), e);
        }
    }

    /**
     * Best-effort visible text. Page title and site name are put first as hints
     * for the extractor.
     */
    String extractVisibleText(String html, String baseUri) {
        if (html == null || html.isBlank()) {
            throw new ResolutionException(Reason.FETCH_FAILED, "Job posting " + baseUri + " returned an empty page");
        }
        Document document = Jsoup.parse(html, baseUri);
        String title = firstNonBlank(
                metaContent(document, "og:title"),
                textOf(document.selectFirst("h1")),
                document.title());
        String siteName = metaContent(document, "og:site_name");

        document.select("script, style, noscript, template, svg, iframe").remove();
        String body = document.body() != null ? document.body().text() : document.text();

        StringBuilder text = new StringBuilder();
        if (!title.isBlank()) {
            text.append("Title: ").append(title).append('\n');
        }
        if (!siteName.isBlank()) {
            text.append("Site: ").append(siteName).append('\n');
        }
        text.append(body);
        String result = text.toString().strip();
        if (result.isBlank()) {
            throw new ResolutionException(Reason.FETCH_FAILED, "No readable text found at " + baseUri);
        }
        return result;
    }

    private static String metaContent(Document document, String property) {
        Element meta = document.selectFirst("meta[property=" + property + "]");
        return meta == null ? "" : meta.attr("content").trim();
    }

    private static String textOf(Element element) {
        return element == null ? "" : element.text().trim();
    }

    private static String firstNonBlank(String... values) {
        for (String value : values) {
            if (value != null && !value.isBlank()) {
                return value.trim();
            }
        }
        return "";
    }

    private static String loadDefaultTemplate() {
        try (InputStream in = new ClassPathResource(DEFAULT_TEMPLATE).getInputStream()) {
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("Missing built-in job template " + DEFAULT_TEMPLATE, e);
        }
    }
}
