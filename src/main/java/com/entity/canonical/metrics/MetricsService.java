package com.entity.canonical.metrics;

import java.time.Duration;

/**
 * Records resolution and indexing metrics.
 * The default {@link NoOpMetricsService} keeps the library usable without any
 * metrics dependency on the classpath.
 */
public interface MetricsService {

    /**
     * @param path one of {@code exact}, {@code fuzzy} or {@code system}
     */
    void recordResolutionDuration(String entityType, String path, Duration duration);

    void incrementResolutionMiss(String entityType);

    void incrementAmbiguousMatch(String entityType);

    void recordCandidateCount(String entityType, int count);

    void recordFitDuration(String entityType, Duration duration);

    void recordDocumentsIndexed(String entityType, long indexed, long failed);

    /**
     * Counts one fuzzy-path cache lookup for the type.
     */
    void recordCacheLookup(String entityType, boolean hit);
}
