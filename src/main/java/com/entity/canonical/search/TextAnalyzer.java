package com.entity.canonical.search;

import com.entity.canonical.rules.NormalizationEngine;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Turns text into the keyword, term and n-gram forms described by {@link IndexSettings}.
 * Used identically at index time and query time. Thread-safe.
 */
public class TextAnalyzer {

    private final IndexSettings settings;
    private final NormalizationEngine charFilters;

    public TextAnalyzer(IndexSettings settings) {
        this.settings = settings;
        // priority 0 on every filter keeps the configured order (stable sort)
        this.charFilters = new NormalizationEngine(settings.toRules());
    }

    public IndexSettings getSettings() {
        return settings;
    }

    public String keyword(String text) {
        return charFilters.normalize(text);
    }

    /**
     * Whitespace tokens followed by the configured shingles.
     */
    public Set<String> terms(String text) {
        List<String> tokens = tokens(text);
        Set<String> terms = new LinkedHashSet<>(tokens);
        for (int size = settings.shingleMinSize(); size <= settings.shingleMaxSize(); size++) {
            for (int start = 0; start + size <= tokens.size(); start++) {
                terms.add(String.join(" ", tokens.subList(start, start + size)));
            }
        }
        return terms;
    }

    /**
     * Edge n-grams of every token. Tokens shorter than the minimum gram are kept
     * whole so that short words still take part in partial matching.
     */
    public Set<String> grams(String text) {
        Set<String> grams = new LinkedHashSet<>();
        for (String token : tokens(text)) {
            if (token.length() < settings.minGram()) {
                grams.add(token);
                continue;
            }
            int longest = Math.min(settings.maxGram(), token.length());
            for (int length = settings.minGram(); length <= longest; length++) {
                grams.add(token.substring(0, length));
            }
        }
        return grams;
    }

    public AnalyzedValue analyze(String text) {
        String keyword = keyword(text);
        return new AnalyzedValue(keyword, terms(keyword), grams(keyword));
    }

    private List<String> tokens(String text) {
        String keyword = keyword(text);
        if (keyword.isEmpty()) {
            return Collections.emptyList();
        }
        List<String> tokens = new ArrayList<>();
        for (String token : keyword.split(" ")) {
            if (!token.isEmpty()) {
                tokens.add(token);
            }
        }
        return tokens;
    }

    /**
     * One field value in its three analyzed forms.
     */
    public record AnalyzedValue(String keyword, Set<String> terms, Set<String> grams) {
        public AnalyzedValue {
            terms = Set.copyOf(terms);
            grams = Set.copyOf(grams);
        }
    }
}
