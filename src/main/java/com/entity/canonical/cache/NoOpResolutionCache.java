package com.entity.canonical.cache;

import com.entity.canonical.core.model.ResolvedCandidate;

import java.util.List;
import java.util.Optional;

/**
 * Stores nothing; every fuzzy request reaches the search backend.
 */
public class NoOpResolutionCache implements ResolutionCache {

    @Override
    public Optional<List<ResolvedCandidate>> get(String entityType, String normalizedText) {
        return Optional.empty();
    }

    @Override
    public void put(String entityType, String normalizedText, List<ResolvedCandidate> candidates) {
    }

    @Override
    public void invalidateType(String entityType) {
    }

    @Override
    public void invalidateAll() {
    }

    @Override
    public long size() {
        return 0;
    }
}
