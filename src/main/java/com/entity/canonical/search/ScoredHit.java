package com.entity.canonical.search;

/**
 * A document that matched at least one clause, with its aggregate score.
 */
public record ScoredHit(SynonymDocument document, double score) {
}
