package com.entity.canonical.search;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class ClauseScorerTest {

    private TextAnalyzer analyzer;
    private ClauseScorer scorer;
    private AnalyzedDocument seattle;

    @BeforeEach
    void setUp() {
        analyzer = new TextAnalyzer(IndexSettings.DEFAULT);
        scorer = new ClauseScorer(analyzer);
        seattle = AnalyzedDocument.of(
                new SynonymDocument("city_1", "Seattle", List.of("SEA", "Emerald City"), Map.of()),
                analyzer);
    }

    private static SynonymQuery fullQuery(String text) {
        return SynonymQuery.builder()
                .text(text)
                .clause(ClauseType.KEYWORD, SearchField.WHITELIST, 10)
                .clause(ClauseType.KEYWORD, SearchField.CNAME, 10)
                .clause(ClauseType.FULL_TEXT, SearchField.WHITELIST, 2)
                .clause(ClauseType.FULL_TEXT, SearchField.CNAME, 2)
                .clause(ClauseType.NGRAM, SearchField.CNAME, 1)
                .clause(ClauseType.NGRAM, SearchField.WHITELIST, 1)
                .build();
    }

    private double score(SynonymQuery query) {
        return scorer.score(scorer.prepare(query), seattle);
    }

    @Nested
    @DisplayName("Boosted sum")
    class BoostedSumTests {

        @Test
        @DisplayName("Exact cname scores keyword, full text and n-gram clauses")
        void testExactCname() {
            assertEquals(13.0, score(fullQuery("seattle")), 1e-9);
        }

        @Test
        @DisplayName("Exact alias scores the whitelist clauses")
        void testExactAlias() {
            assertEquals(13.0, score(fullQuery("emerald city")), 1e-9);
        }

        @Test
        @DisplayName("Partial alias scores token and gram overlap only")
        void testPartialAlias() {
            // terms: 2*1/(1+3) = 0.5, grams: 2*4/(4+5)
            assertEquals(2 * 0.5 + 8.0 / 9.0, score(fullQuery("emerald")), 1e-9);
        }

        @Test
        @DisplayName("Prefix matches through edge n-grams")
        void testPrefix() {
            // grams: {seat, seatt} vs {seat, seatt, seatte, seattle}
            assertEquals(2.0 * 2 / 6, score(fullQuery("seatt")), 1e-9);
        }

        @Test
        @DisplayName("Unrelated text scores zero")
        void testNoMatch() {
            assertEquals(0.0, score(fullQuery("portland")));
        }
    }

    @Nested
    @DisplayName("Single clauses")
    class SingleClauseTests {

        @Test
        @DisplayName("Keyword clause only matches whole values")
        void testKeywordOnly() {
            SynonymQuery query = SynonymQuery.builder()
                    .text("sea")
                    .clause(ClauseType.KEYWORD, SearchField.WHITELIST, 10)
                    .build();
            assertEquals(10.0, score(query));

            SynonymQuery cnameOnly = SynonymQuery.builder()
                    .text("sea")
                    .clause(ClauseType.KEYWORD, SearchField.CNAME, 10)
                    .build();
            assertEquals(0.0, score(cnameOnly));
        }

        @Test
        @DisplayName("Each clause takes the best value of a multi-valued field")
        void testBestValue() {
            SynonymQuery query = SynonymQuery.builder()
                    .text("emerald city")
                    .clause(ClauseType.FULL_TEXT, SearchField.WHITELIST, 1)
                    .build();
            assertEquals(1.0, score(query), 1e-9);
        }

        @Test
        @DisplayName("An empty keyword never matches")
        void testEmptyKeyword() {
            AnalyzedDocument blank = AnalyzedDocument.of(
                    new SynonymDocument("x", "Blank", List.of("!!!"), Map.of()), analyzer);
            SynonymQuery query = SynonymQuery.builder()
                    .text("???")
                    .clause(ClauseType.KEYWORD, SearchField.WHITELIST, 10)
                    .build();
            assertEquals(0.0, scorer.score(scorer.prepare(query), blank));
        }
    }

    @Test
    @DisplayName("Dice coefficient of two sets")
    void testDice() {
        assertEquals(1.0, ClauseScorer.dice(Set.of("a", "b"), Set.of("a", "b")));
        assertEquals(0.5, ClauseScorer.dice(Set.of("a"), Set.of("a", "b", "c")));
        assertEquals(0.0, ClauseScorer.dice(Set.of(), Set.of("a")));
    }
}
