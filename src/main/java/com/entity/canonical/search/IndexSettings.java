package com.entity.canonical.search;

import com.entity.canonical.rules.DefaultNormalizationRules;
import com.entity.canonical.rules.NormalizationRule;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Analysis configuration of a synonym index.
 *
 * <p>Every text field is indexed three ways: as a single normalized keyword
 * (character filters, ASCII folding, lower-casing), as whitespace tokens plus
 * token shingles, and as per-token edge n-grams.</p>
 *
 * @param shingleMinSize smallest shingle, in tokens
 * @param shingleMaxSize largest shingle, in tokens
 * @param minGram        shortest edge n-gram, in characters
 * @param maxGram        longest edge n-gram, in characters
 * @param charFilters    regex rewrites applied before tokenization, in order
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record IndexSettings(
        @JsonProperty("shingleMinSize") int shingleMinSize,
        @JsonProperty("shingleMaxSize") int shingleMaxSize,
        @JsonProperty("minGram") int minGram,
        @JsonProperty("maxGram") int maxGram,
        @JsonProperty("charFilters") List<CharFilter> charFilters
) {

    /**
     * Settings used for every index created by the lifecycle manager.
     */
    public static final IndexSettings DEFAULT = new IndexSettings(2, 4, 4, 20,
            DefaultNormalizationRules.getRules().stream()
                    .map(rule -> new CharFilter(rule.name(), rule.pattern().pattern(),
                            rule.replacement()))
                    .toList());

    public IndexSettings {
        if (shingleMinSize < 2 || shingleMaxSize < shingleMinSize) {
            throw new IllegalArgumentException("invalid shingle range " + shingleMinSize + ".." + shingleMaxSize);
        }
        if (minGram < 1 || maxGram < minGram) {
            throw new IllegalArgumentException("invalid n-gram range " + minGram + ".." + maxGram);
        }
        charFilters = charFilters != null ? List.copyOf(charFilters) : List.of();
    }

    List<NormalizationRule> toRules() {
        return charFilters.stream()
                .map(filter -> NormalizationRule.of(filter.name(), 0, filter.pattern(), filter.replacement()))
                .toList();
    }

    /**
     * A pattern-replace character filter.
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record CharFilter(
            @JsonProperty("name") String name,
            @JsonProperty("pattern") String pattern,
            @JsonProperty("replacement") String replacement
    ) {
    }
}
