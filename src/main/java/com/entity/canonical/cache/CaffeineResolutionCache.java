package com.entity.canonical.cache;

import com.entity.canonical.core.model.ResolvedCandidate;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * One Caffeine cache per entity type, so a fit drops its own type's results
 * without scanning the others.
 */
public class CaffeineResolutionCache implements ResolutionCache {
    private static final Logger log = LoggerFactory.getLogger(CaffeineResolutionCache.class);

    private final CacheConfig config;
    private final ConcurrentHashMap<String, Cache<String, List<ResolvedCandidate>>> byType =
            new ConcurrentHashMap<>();

    public CaffeineResolutionCache(CacheConfig config) {
        this.config = config;
        log.info("cache.configured maxEntriesPerType={} ttl={}", config.maxEntriesPerType(), config.ttl());
    }

    @Override
    public Optional<List<ResolvedCandidate>> get(String entityType, String normalizedText) {
        Cache<String, List<ResolvedCandidate>> cache = byType.get(entityType);
        return cache == null ? Optional.empty() : Optional.ofNullable(cache.getIfPresent(normalizedText));
    }

    @Override
    public void put(String entityType, String normalizedText, List<ResolvedCandidate> candidates) {
        byType.computeIfAbsent(entityType, type -> newCache())
                .put(normalizedText, List.copyOf(candidates));
    }

    @Override
    public void invalidateType(String entityType) {
        Cache<String, List<ResolvedCandidate>> removed = byType.remove(entityType);
        if (removed != null) {
            log.debug("cache.invalidated type={} entries={}", entityType, removed.estimatedSize());
            removed.invalidateAll();
        }
    }

    @Override
    public void invalidateAll() {
        byType.keySet().forEach(this::invalidateType);
    }

    @Override
    public long size() {
        return byType.values().stream().mapToLong(Cache::estimatedSize).sum();
    }

    private Cache<String, List<ResolvedCandidate>> newCache() {
        return Caffeine.newBuilder()
                .maximumSize(config.maxEntriesPerType())
                .expireAfterWrite(config.ttl())
                .build();
    }
}
