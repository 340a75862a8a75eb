package com.entity.canonical.rest.dto;

import com.entity.canonical.api.FitResult;
import com.entity.canonical.bulk.IndexingResult;

import java.util.List;

/**
 * Response DTO summarizing a fit.
 */
public record FitResponse(
        String entityType,
        boolean clean,
        int items,
        int aliases,
        long indexed,
        List<IndexingResult.IndexingFailure> failures,
        boolean aborted,
        long durationMillis
) {
    public static FitResponse from(FitResult result) {
        return new FitResponse(
                result.entityType(),
                result.clean(),
                result.items(),
                result.aliases(),
                result.indexing().indexed(),
                result.indexing().failures(),
                result.indexing().aborted(),
                result.duration().toMillis()
        );
    }
}
