package com.entity.canonical.cache;

import java.time.Duration;
import java.util.Objects;

/**
 * Bounds of the fuzzy result cache.
 *
 * @param maxEntriesPerType ranked lists kept for one entity type before the least used are evicted
 * @param ttl               lifetime of a cached list after it was written
 */
public record CacheConfig(long maxEntriesPerType, Duration ttl) {

    public CacheConfig {
        if (maxEntriesPerType <= 0) {
            throw new IllegalArgumentException("maxEntriesPerType must be > 0");
        }
        Objects.requireNonNull(ttl, "ttl is required");
        if (ttl.isNegative() || ttl.isZero()) {
            throw new IllegalArgumentException("ttl must be positive");
        }
    }

    /**
     * 10,000 lists per type for five minutes.
     */
    public static CacheConfig defaults() {
        return new CacheConfig(10_000, Duration.ofMinutes(5));
    }
}
