package dev.autoresume.fetch;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

class InMemoryResponseCacheTest {

    private MutableClock clock;
    private InMemoryResponseCache cache;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2024-05-01T10:00:00Z"));
        cache = new InMemoryResponseCache(clock);
    }

    private CacheEntry entry(String key, String body) {
        return new CacheEntry(key, body.getBytes(StandardCharsets.UTF_8), clock.instant(), Duration.ofHours(1));
    }

    @Test
    @DisplayName("Should return a live entry")
    void shouldReturnLiveEntry() {
        cache.put(entry("k1", "hello"));

        assertThat(cache.get("k1")).hasValueSatisfying(e ->
                assertThat(new String(e.body(), StandardCharsets.UTF_8)).isEqualTo("hello"));
        assertThat(cache.containsLive("k1")).isTrue();
    }

    @Test
    @DisplayName("Should keep an entry alive exactly up to its TTL")
    void shouldKeepEntryUntilTtl() {
        cache.put(entry("k1", "hello"));
        clock.advance(Duration.ofHours(1));

        assertThat(cache.get("k1")).isPresent();
    }

    @Test
    @DisplayName("Should evict an expired entry on read")
    void shouldEvictExpiredEntry() {
        cache.put(entry("k1", "hello"));
        clock.advance(Duration.ofHours(1).plusSeconds(1));

        assertThat(cache.get("k1")).isEmpty();
        assertThat(cache.size()).isZero();
    }

    @Test
    @DisplayName("Should let the last writer win")
    void shouldOverwriteEntry() {
        cache.put(entry("k1", "first"));
        cache.put(entry("k1", "second"));

        assertThat(cache.get("k1")).hasValueSatisfying(e ->
                assertThat(new String(e.body(), StandardCharsets.UTF_8)).isEqualTo("second"));
        assertThat(cache.size()).isEqualTo(1);
    }
}
