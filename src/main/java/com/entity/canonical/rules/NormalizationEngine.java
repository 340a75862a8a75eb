package com.entity.canonical.rules;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Immutable, rule-based {@link Normalizer}. The rules run in priority order;
 * the result is then ASCII-folded, lower-cased and whitespace-collapsed.
 *
 * <p>Blank input normalizes to the empty string. Normalizing twice gives the
 * same result as normalizing once.</p>
 */
public final class NormalizationEngine implements Normalizer {
    private static final Logger log = LoggerFactory.getLogger(NormalizationEngine.class);

    private static final Pattern COMBINING_MARKS = Pattern.compile("\\p{M}+");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private final List<NormalizationRule> rules;

    public NormalizationEngine(List<NormalizationRule> rules) {
        List<NormalizationRule> ordered = new ArrayList<>(rules);
        ordered.sort(Comparator.comparingInt(NormalizationRule::priority));
        this.rules = List.copyOf(ordered);
    }

    /**
     * An engine that only folds case, accents and whitespace.
     */
    public static NormalizationEngine foldingOnly() {
        return new NormalizationEngine(List.of());
    }

    public NormalizationEngine withRule(NormalizationRule rule) {
        List<NormalizationRule> extended = new ArrayList<>(rules);
        extended.add(rule);
        return new NormalizationEngine(extended);
    }

    public NormalizationEngine withoutRule(String name) {
        return new NormalizationEngine(rules.stream().filter(rule -> !rule.name().equals(name)).toList());
    }

    public List<NormalizationRule> rules() {
        return rules;
    }

    @Override
    public String normalize(String text) {
        if (text == null || text.isBlank()) {
            return "";
        }

        String result = text;
        for (NormalizationRule rule : rules) {
            String rewritten = rule.apply(result);
            if (log.isTraceEnabled() && !rewritten.equals(result)) {
                log.trace("normalize.rule name={} before='{}' after='{}'", rule.name(), result, rewritten);
            }
            result = rewritten;
        }
        String folded = foldToAscii(result).toLowerCase(Locale.ROOT).trim();
        return WHITESPACE.matcher(folded).replaceAll(" ");
    }

    static String foldToAscii(String text) {
        String decomposed = java.text.Normalizer.normalize(text, java.text.Normalizer.Form.NFKD);
        return COMBINING_MARKS.matcher(decomposed).replaceAll("");
    }
}
