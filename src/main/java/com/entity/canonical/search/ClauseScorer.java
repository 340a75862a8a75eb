package com.entity.canonical.search;

import java.util.Set;

/**
 * Scores analyzed documents against a {@link SynonymQuery}.
 *
 * <p>Each clause scores the best matching value of its field in [0, 1]: keyword
 * clauses score 1 on equality, term and n-gram clauses score the Dice overlap of
 * the two sets. The document score is the boosted sum over matching clauses.</p>
 */
public class ClauseScorer {

    private final TextAnalyzer analyzer;

    public ClauseScorer(TextAnalyzer analyzer) {
        this.analyzer = analyzer;
    }

    public PreparedQuery prepare(SynonymQuery query) {
        return new PreparedQuery(query, analyzer.analyze(query.getText()));
    }

    /**
     * Returns the document's score, or 0 when no clause matches.
     */
    public double score(PreparedQuery prepared, AnalyzedDocument document) {
        double total = 0.0;
        for (QueryClause clause : prepared.query().getClauses()) {
            double best = 0.0;
            for (TextAnalyzer.AnalyzedValue value : document.values(clause.field())) {
                best = Math.max(best, match(clause.type(), prepared.analyzed(), value));
            }
            total += clause.boost() * best;
        }
        return total;
    }

    private static double match(ClauseType type, TextAnalyzer.AnalyzedValue query,
                                TextAnalyzer.AnalyzedValue value) {
        return switch (type) {
            case KEYWORD -> !query.keyword().isEmpty() && query.keyword().equals(value.keyword()) ? 1.0 : 0.0;
            case FULL_TEXT -> dice(query.terms(), value.terms());
            case NGRAM -> dice(query.grams(), value.grams());
        };
    }

    static double dice(Set<String> a, Set<String> b) {
        if (a.isEmpty() || b.isEmpty()) {
            return 0.0;
        }
        int shared = 0;
        Set<String> smaller = a.size() <= b.size() ? a : b;
        Set<String> larger = smaller == a ? b : a;
        for (String item : smaller) {
            if (larger.contains(item)) {
                shared++;
            }
        }
        return 2.0 * shared / (a.size() + b.size());
    }

    /**
     * A query with its text analyzed once.
     */
    public record PreparedQuery(SynonymQuery query, TextAnalyzer.AnalyzedValue analyzed) {
    }
}
