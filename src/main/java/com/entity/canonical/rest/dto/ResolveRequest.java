package com.entity.canonical.rest.dto;

/**
 * Request DTO for resolving one mention. The entity type comes from the path.
 *
 * @param text           the mention text
 * @param value          pre-resolved value, used for system entity types
 * @param exactMatchOnly restrict resolution to the synonym table
 * @param topK           maximum number of fuzzy candidates; server default when null
 */
public record ResolveRequest(
        String text,
        Object value,
        Boolean exactMatchOnly,
        Integer topK
) {
    public ResolveRequest {
        if (text == null) {
            throw new IllegalArgumentException("text is required");
        }
        if (topK != null && topK <= 0) {
            throw new IllegalArgumentException("topK must be positive");
        }
    }

    public boolean isExactMatchOnly() {
        return Boolean.TRUE.equals(exactMatchOnly);
    }
}
