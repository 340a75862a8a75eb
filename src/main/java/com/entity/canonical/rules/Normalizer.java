package com.entity.canonical.rules;

/**
 * Pure text normalization function used for both indexing aliases and looking up
 * mentions. Implementations must be deterministic and free of side effects.
 */
@FunctionalInterface
public interface Normalizer {

    String normalize(String text);
}
