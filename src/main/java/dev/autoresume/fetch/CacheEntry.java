package dev.autoresume.fetch;

import java.time.Duration;
import java.time.Instant;

/**
 * A stored response body. Immutable once written; a later write for the same key replaces it.
 */
public record CacheEntry(String key, byte[] body, Instant storedAt, Duration ttl) {

    public boolean isExpired(Instant now) {
        return Duration.between(storedAt, now).compareTo(ttl) > 0;
    }
}
