package com.entity.canonical.cache;

import com.entity.canonical.core.model.ResolvedCandidate;

import java.util.List;
import java.util.Optional;

/**
 * Fuzzy resolution results keyed by entity type and normalized mention text.
 * A cached list holds every ranked candidate, before truncation to top-k, so
 * one entry serves any {@code topK}.
 */
public interface ResolutionCache {

    Optional<List<ResolvedCandidate>> get(String entityType, String normalizedText);

    void put(String entityType, String normalizedText, List<ResolvedCandidate> candidates);

    /**
     * Forgets every result of one entity type. Each fit of the type calls this.
     */
    void invalidateType(String entityType);

    void invalidateAll();

    /**
     * Approximate number of cached lists across all types.
     */
    long size();
}
