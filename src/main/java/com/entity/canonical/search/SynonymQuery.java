package com.entity.canonical.search;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Disjunctive, boosted query over synonym documents with grouping by cname.
 * A document matching any clause is a hit; its score is the sum of
 * {@code boost * matchScore} over the clauses it matches.
 */
public final class SynonymQuery {

    private final String text;
    private final List<QueryClause> clauses;
    private final int sampleSize;
    private final int maxGroups;

    private SynonymQuery(Builder builder) {
        this.text = builder.text;
        this.clauses = List.copyOf(builder.clauses);
        this.sampleSize = builder.sampleSize;
        this.maxGroups = builder.maxGroups;
    }

    /**
     * The normalized mention text.
     */
    public String getText() {
        return text;
    }

    public List<QueryClause> getClauses() {
        return clauses;
    }

    /**
     * Maximum number of hits sampled per cname group.
     */
    public int getSampleSize() {
        return sampleSize;
    }

    /**
     * Maximum number of distinct cname groups returned.
     */
    public int getMaxGroups() {
        return maxGroups;
    }

    @Override
    public String toString() {
        return "SynonymQuery{text='" + text + "', clauses=" + clauses +
                ", sampleSize=" + sampleSize + ", maxGroups=" + maxGroups + '}';
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String text;
        private final List<QueryClause> clauses = new ArrayList<>();
        private int sampleSize = 20;
        private int maxGroups = 100;

        public Builder text(String text) {
            this.text = text;
            return this;
        }

        public Builder clause(ClauseType type, SearchField field, double boost) {
            this.clauses.add(new QueryClause(type, field, boost));
            return this;
        }

        public Builder sampleSize(int sampleSize) {
            if (sampleSize <= 0) throw new IllegalArgumentException("sampleSize must be > 0");
            this.sampleSize = sampleSize;
            return this;
        }

        public Builder maxGroups(int maxGroups) {
            if (maxGroups <= 0) throw new IllegalArgumentException("maxGroups must be > 0");
            this.maxGroups = maxGroups;
            return this;
        }

        public SynonymQuery build() {
            Objects.requireNonNull(text, "text is required");
            if (clauses.isEmpty()) {
                throw new IllegalArgumentException("at least one clause is required");
            }
            return new SynonymQuery(this);
        }
    }
}
