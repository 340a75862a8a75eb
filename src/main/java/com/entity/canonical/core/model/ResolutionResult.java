package com.entity.canonical.core.model;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Outcome of resolving one mention.
 *
 * <p>Exact resolution yields concrete records, fuzzy resolution yields ranked
 * canonical names without record detail, an exact-path miss degrades to the raw
 * mention text, and system entities pass their NLU value through untouched.</p>
 */
public sealed interface ResolutionResult
        permits ResolutionResult.ExactMatches, ResolutionResult.RankedCandidates,
        ResolutionResult.Unresolved, ResolutionResult.PreResolved {

    /**
     * Whether the mention was mapped to at least one canonical name.
     */
    boolean isResolved();

    /**
     * Records found through the synonym table, alias lists stripped.
     * Ordered by cname discovery order, then item insertion order.
     */
    record ExactMatches(List<Map<String, Object>> items) implements ResolutionResult {
        public ExactMatches {
            items = List.copyOf(items);
        }

        @Override
        public boolean isResolved() {
            return !items.isEmpty();
        }
    }

    /**
     * Candidates from the search backend, best first.
     */
    record RankedCandidates(List<ResolvedCandidate> candidates) implements ResolutionResult {
        public RankedCandidates {
            candidates = List.copyOf(candidates);
        }

        @Override
        public boolean isResolved() {
            return !candidates.isEmpty();
        }

        public ResolvedCandidate top() {
            return candidates.isEmpty() ? null : candidates.get(0);
        }
    }

    /**
     * No synonym matched; carries the original mention text as a fallback.
     */
    record Unresolved(String text) implements ResolutionResult {
        public Unresolved {
            Objects.requireNonNull(text, "text is required");
        }

        @Override
        public boolean isResolved() {
            return false;
        }
    }

    /**
     * A system entity whose value was resolved upstream.
     */
    record PreResolved(Object value) implements ResolutionResult {
        @Override
        public boolean isResolved() {
            return true;
        }
    }
}
