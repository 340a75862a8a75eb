package com.entity.canonical.metrics;

import java.time.Duration;

/**
 * Default {@link MetricsService}; discards everything.
 */
public class NoOpMetricsService implements MetricsService {

    @Override
    public void recordResolutionDuration(String entityType, String path, Duration duration) {
    }

    @Override
    public void incrementResolutionMiss(String entityType) {
    }

    @Override
    public void incrementAmbiguousMatch(String entityType) {
    }

    @Override
    public void recordCandidateCount(String entityType, int count) {
    }

    @Override
    public void recordFitDuration(String entityType, Duration duration) {
    }

    @Override
    public void recordDocumentsIndexed(String entityType, long indexed, long failed) {
    }

    @Override
    public void recordCacheLookup(String entityType, boolean hit) {
    }
}
