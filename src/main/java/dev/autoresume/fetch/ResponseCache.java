package dev.autoresume.fetch;

import java.util.Optional;

/**
 * Content-addressed store of prior response bodies.
 * Implementations must tolerate concurrent writers for the same key.
 */
public interface ResponseCache {

    /**
     * Return the live entry for a key. An expired entry is evicted and reported as absent.
     */
    Optional<CacheEntry> get(String key);

    void put(CacheEntry entry);

    default boolean containsLive(String key) {
        return get(key).isPresent();
    }
}
