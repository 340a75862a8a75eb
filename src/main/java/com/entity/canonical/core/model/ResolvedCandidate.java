package com.entity.canonical.core.model;

import java.util.Objects;

/**
 * A ranked fuzzy-match candidate.
 *
 * @param cname          the canonical name of the candidate group
 * @param relevanceScore score of the group's best hit
 * @param hitCount       number of sampled documents that matched within the group
 */
public record ResolvedCandidate(String cname, double relevanceScore, long hitCount) {

    public ResolvedCandidate {
        Objects.requireNonNull(cname, "cname is required");
        if (hitCount < 0) {
            throw new IllegalArgumentException("hitCount must be >= 0");
        }
    }
}
