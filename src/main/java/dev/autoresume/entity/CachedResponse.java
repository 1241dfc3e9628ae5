package dev.autoresume.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Entity for response bodies kept between runs by the persistent cache.
 */
@Data
@Entity
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Table(name = "response_cache", indexes = {
        @Index(name = "idx_response_cache_stored_at", columnList = "storedAt")
})
public class CachedResponse {

    @Id
    @Column(length = 64)
    private String cacheKey;

    @Column(nullable = false, columnDefinition = "BLOB")
    private byte[] body;

    @Column(nullable = false)
    private Instant storedAt;

    @Column(nullable = false)
    private long ttlMillis;
}
