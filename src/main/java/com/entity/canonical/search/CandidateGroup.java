package com.entity.canonical.search;

/**
 * Hits of one canonical name, summarized by the best-scoring hit.
 *
 * @param cname    grouping key
 * @param topScore score of the best hit in the group
 * @param hitCount sampled hits in the group, at most the query's sample size
 * @param topHit   the best hit itself
 */
public record CandidateGroup(String cname, double topScore, long hitCount, SynonymDocument topHit) {
}
