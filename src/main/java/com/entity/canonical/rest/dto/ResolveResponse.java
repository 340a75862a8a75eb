package com.entity.canonical.rest.dto;

import com.entity.canonical.core.model.ResolutionResult;
import com.entity.canonical.core.model.ResolvedCandidate;

import java.util.List;
import java.util.Map;

/**
 * Response DTO for a resolution. Exactly one of {@code items}, {@code candidates}
 * and {@code value} is populated, depending on {@code status}.
 */
public record ResolveResponse(
        String entityType,
        String text,
        Status status,
        List<Map<String, Object>> items,
        List<ResolvedCandidate> candidates,
        Object value
) {
    public enum Status { EXACT, RANKED, UNRESOLVED, PRE_RESOLVED }

    public static ResolveResponse from(String entityType, String text, ResolutionResult result) {
        if (result instanceof ResolutionResult.ExactMatches exact) {
            return new ResolveResponse(entityType, text, Status.EXACT, exact.items(), null, null);
        }
        if (result instanceof ResolutionResult.RankedCandidates ranked) {
            return new ResolveResponse(entityType, text, Status.RANKED, null, ranked.candidates(), null);
        }
        if (result instanceof ResolutionResult.Unresolved unresolved) {
            return new ResolveResponse(entityType, text, Status.UNRESOLVED, null, null, unresolved.text());
        }
        ResolutionResult.PreResolved preResolved = (ResolutionResult.PreResolved) result;
        return new ResolveResponse(entityType, text, Status.PRE_RESOLVED, null, null, preResolved.value());
    }
}
