package com.entity.canonical.search;

import java.util.Objects;

/**
 * One OR-combined clause of a {@link SynonymQuery}.
 *
 * @param type  comparison applied to the field
 * @param field targeted document field
 * @param boost multiplier applied to the clause's match score
 */
public record QueryClause(ClauseType type, SearchField field, double boost) {

    public QueryClause {
        Objects.requireNonNull(type, "type is required");
        Objects.requireNonNull(field, "field is required");
        if (boost <= 0) {
            throw new IllegalArgumentException("boost must be > 0");
        }
    }
}
