package com.entity.canonical.search;

import java.util.List;

/**
 * Grouped result of a {@link SynonymQuery}, in the backend's native group order.
 *
 * @param groups     candidate groups, at most the query's group cap
 * @param totalHits  number of matching documents before grouping
 * @param tookMillis time spent in the backend
 */
public record SearchResponse(List<CandidateGroup> groups, long totalHits, long tookMillis) {

    public SearchResponse {
        groups = groups != null ? List.copyOf(groups) : List.of();
    }

    public static SearchResponse empty() {
        return new SearchResponse(List.of(), 0, 0);
    }
}
