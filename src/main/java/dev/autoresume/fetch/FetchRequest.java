package dev.autoresume.fetch;

import org.springframework.http.HttpMethod;
import org.springframework.util.DigestUtils;

import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;

/**
 * An outbound GET/HEAD-style request. Only headers that change the returned
 * representation take part in the cache key; credentials do not.
 */
public record FetchRequest(HttpMethod method, String url, Map<String, String> headers, boolean cacheable) {

    private static final List<String> REPRESENTATION_HEADERS = List.of("accept", "accept-language");

    public FetchRequest {
        headers = headers == null ? Map.of() : Map.copyOf(headers);
    }

    public static FetchRequest get(String url) {
        return new FetchRequest(HttpMethod.GET, url, Map.of(), true);
    }

    public FetchRequest withHeader(String name, String value) {
        Map<String, String> copy = new LinkedHashMap<>(headers);
        copy.put(name, value);
        return new FetchRequest(method, url, copy, cacheable);
    }

    public FetchRequest uncached() {
        return new FetchRequest(method, url, headers, false);
    }

    /**
     * Deterministic content key: method, URL and representation-affecting headers.
     */
    public String cacheKey() {
        StringBuilder material = new StringBuilder()
                .append(method.name()).append(' ').append(url);
        Map<String, String> sorted = new TreeMap<>();
        headers.forEach((name, value) -> {
            String lower = name.toLowerCase(Locale.ROOT);
            if (REPRESENTATION_HEADERS.contains(lower)) {
                sorted.put(lower, value);
            }
        });
        sorted.forEach((name, value) -> material.append('\n').append(name).append(": ").append(value));
        return DigestUtils.md5DigestAsHex(material.toString().getBytes(StandardCharsets.UTF_8));
    }
}
