package com.entity.canonical.api;

import com.entity.canonical.bulk.IndexingResult;

import java.time.Duration;

/**
 * Outcome of one {@link EntityResolver#fit(boolean) fit}.
 *
 * @param entityType the entity type that was fitted
 * @param clean      whether the backend index was recreated
 * @param items      number of items in the published synonym index
 * @param aliases    number of distinct normalized aliases
 * @param indexing   backend ingestion result
 * @param duration   wall-clock time of the fit
 */
public record FitResult(
        String entityType,
        boolean clean,
        int items,
        int aliases,
        IndexingResult indexing,
        Duration duration
) {

    /**
     * Result for system entity types, which have nothing to index.
     */
    public static FitResult skipped(String entityType, boolean clean) {
        return new FitResult(entityType, clean, 0, 0, IndexingResult.empty(), Duration.ZERO);
    }

    public boolean isComplete() {
        return !indexing.aborted() && !indexing.hasFailures();
    }
}
