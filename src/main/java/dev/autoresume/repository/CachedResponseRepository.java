package dev.autoresume.repository;

import dev.autoresume.entity.CachedResponse;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

/**
 * Repository for persisted response cache rows, keyed by cache key.
 */
@Repository
public interface CachedResponseRepository extends JpaRepository<CachedResponse, String> {
}
