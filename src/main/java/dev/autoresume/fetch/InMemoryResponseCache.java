package dev.autoresume.fetch;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Run-scoped cache. Entries disappear with the process.
 */
@Slf4j
@Component
@ConditionalOnProperty(name = "fetch.cache.store", havingValue = "memory")
public class InMemoryResponseCache implements ResponseCache {

    private final Map<String, CacheEntry> entries = new ConcurrentHashMap<>();
    private final Clock clock;

    public InMemoryResponseCache(Clock clock) {
        this.clock = clock;
    }

    @Override
    public Optional<CacheEntry> get(String key) {
        CacheEntry entry = entries.get(key);
        if (entry == null) {
            return Optional.empty();
        }
        if (entry.isExpired(clock.instant())) {
            entries.remove(key, entry);
            log.debug("Evicted expired cache entry {}", key);
            return Optional.empty();
        }
        return Optional.of(entry);
    }

    @Override
    public void put(CacheEntry entry) {
        entries.put(entry.key(), entry);
    }

    public int size() {
        return entries.size();
    }
}
