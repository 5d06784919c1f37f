package com.retailsales.infrastructure.cache;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory key/value cache with per-entry absolute expiry.
 *
 * Caching Strategy:
 * - Stats: 30 seconds
 * - Filter options: 5 minutes
 * - Whole cache cleared after every ingestion
 *
 * Expired entries are dropped lazily on read and by {@link CacheSweeper}
 * for keys that are never read again. Each operation is a single map
 * operation, so concurrent requests need no further locking.
 */
@Slf4j
@Service
public class TtlCache {

    private final Map<String, CacheEntry> entries = new ConcurrentHashMap<>();
    private final Clock clock;

    public TtlCache(Clock clock) {
        this.clock = clock;
    }

    /**
     * Get a live cached value.
     *
     * An entry is live while now is strictly before its expiry instant.
     */
    public <T> Optional<T> get(String key, Class<T> type) {
        CacheEntry entry = entries.get(key);

        if (entry == null) {
            log.debug("Cache miss for key: {}", key);
            return Optional.empty();
        }

        if (!clock.instant().isBefore(entry.expiresAt())) {
            entries.remove(key, entry);
            log.debug("Cache entry expired for key: {}", key);
            return Optional.empty();
        }

        if (!type.isInstance(entry.value())) {
            log.warn("Cached value for key {} is {}, expected {}",
                    key, entry.value().getClass().getSimpleName(), type.getSimpleName());
            return Optional.empty();
        }

        log.debug("Cache hit for key: {}", key);
        return Optional.of(type.cast(entry.value()));
    }

    /**
     * Store a value, replacing any existing entry for the key.
     */
    public void set(String key, Object value, Duration ttl) {
        entries.put(key, new CacheEntry(value, clock.instant().plus(ttl)));
        log.debug("Cached value for key: {} (TTL: {}s)", key, ttl.toSeconds());
    }

    public void clear() {
        int removed = entries.size();
        entries.clear();
        log.info("Cache cleared ({} entries)", removed);
    }

    /**
     * Remove every expired entry.
     *
     * @return number of entries removed
     */
    public int sweep() {
        Instant now = clock.instant();
        int before = entries.size();
        entries.entrySet().removeIf(e -> !now.isBefore(e.getValue().expiresAt()));
        return before - entries.size();
    }

    public int size() {
        return entries.size();
    }

    private record CacheEntry(Object value, Instant expiresAt) {
    }
}
