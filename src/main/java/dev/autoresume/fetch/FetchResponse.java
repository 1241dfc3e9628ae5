package dev.autoresume.fetch;

import java.nio.charset.StandardCharsets;
import java.util.Locale;
import java.util.Map;

/**
 * Successful response body. Responses served from the cache carry no headers.
 */
public record FetchResponse(int status, byte[] body, Map<String, String> headers, boolean fromCache) {

    public FetchResponse {
        body = body == null ? new byte[0] : body;
        headers = headers == null ? Map.of() : Map.copyOf(headers);
    }

    static FetchResponse cached(CacheEntry entry) {
        return new FetchResponse(200, entry.body(), Map.of(), true);
    }

    public String bodyAsString() {
        return new String(body, StandardCharsets.UTF_8);
    }

    public String header(String name) {
        return headers.get(name.toLowerCase(Locale.ROOT));
    }
}
