package com.entity.canonical.rules;

import java.util.List;

/**
 * Punctuation rules shared by the exact-match normalizer and the search
 * backend's analyzers, so both sides agree on what a surface form is.
 */
public final class DefaultNormalizationRules {

    private static final List<NormalizationRule> RULES = List.of(
            NormalizationRule.of("remove-comma", 10, ",", ""),
            NormalizationRule.of("remove-tm-and-r", 10, "™|®", ""),
            // "rock 'n' roll"
            NormalizationRule.of("remove-loose-apostrophes", 20, " '|' ", " "),
            NormalizationRule.of("space-possessive-apostrophes", 30, "([^\\p{N}\\s]+)'s ", "$1 's "),
            NormalizationRule.of("remove-special-beginning", 40, "^[^\\p{L}\\p{N}\\p{Sc}&']+", ""),
            NormalizationRule.of("remove-special-end", 40, "[^\\p{L}\\p{N}&']+$", ""),
            // "B-52" -> "B 52"
            NormalizationRule.of("split-letter-digit", 50, "(\\p{L}+)[^\\p{L}\\p{N}&']+(?=[\\p{N}\\s]+)", "$1 "),
            NormalizationRule.of("split-digit-letter", 50, "(\\p{N}+)[^\\p{L}\\p{N}&']+(?=[\\p{L}\\s]+)", "$1 "),
            // "St.Louis" -> "St Louis"
            NormalizationRule.of("split-letter-letter", 50, "(\\p{L}+)[^\\p{L}\\p{N}&']+(?=\\p{L}+)", "$1 "));

    private DefaultNormalizationRules() {
    }

    public static NormalizationEngine createDefaultEngine() {
        return new NormalizationEngine(RULES);
    }

    public static List<NormalizationRule> getRules() {
        return RULES;
    }
}
