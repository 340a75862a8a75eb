package com.entity.canonical.search;

/**
 * How a query clause compares the mention against a field.
 */
public enum ClauseType {
    /** Whole normalized value equals the normalized mention. */
    KEYWORD,
    /** Overlap of whitespace tokens and token shingles. */
    FULL_TEXT,
    /** Overlap of edge n-grams, for partial and prefix matches. */
    NGRAM
}
