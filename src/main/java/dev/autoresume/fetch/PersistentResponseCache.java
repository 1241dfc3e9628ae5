package dev.autoresume.fetch;

import dev.autoresume.entity.CachedResponse;
import dev.autoresume.repository.CachedResponseRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Duration;
import java.util.Optional;

/**
 * Cache backed by SQLite, so identical calls are skipped across runs too.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "fetch.cache.store", havingValue = "persistent", matchIfMissing = true)
public class PersistentResponseCache implements ResponseCache {

    private final CachedResponseRepository repository;
    private final Clock clock;

    @Override
    @Transactional
    public Optional<CacheEntry> get(String key) {
        Optional<CachedResponse> row = repository.findById(key);
        if (row.isEmpty()) {
            return Optional.empty();
        }
        CacheEntry entry = toEntry(row.get());
        if (entry.isExpired(clock.instant())) {
            repository.deleteById(key);
            log.debug("Evicted expired cache entry {}", key);
            return Optional.empty();
        }
        return Optional.of(entry);
    }

    @Override
    @Transactional
    public void put(CacheEntry entry) {
        repository.save(CachedResponse.builder()
                .cacheKey(entry.key())
                .body(entry.body())
                .storedAt(entry.storedAt())
                .ttlMillis(entry.ttl().toMillis())
                .build());
    }

    private CacheEntry toEntry(CachedResponse row) {
        return new CacheEntry(row.getCacheKey(), row.getBody(), row.getStoredAt(),
                Duration.ofMillis(row.getTtlMillis()));
    }
}
