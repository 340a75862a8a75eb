package com.entity.canonical.rules;

import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Case-insensitive regex rewrite applied to surface text. Rules with a lower
 * priority run first; rules of equal priority keep their declaration order.
 *
 * @param name        unique within one engine
 * @param pattern     compiled with {@link Pattern#CASE_INSENSITIVE} and {@link Pattern#UNICODE_CASE}
 * @param replacement {@link java.util.regex.Matcher#replaceAll(String)} replacement, may use group references
 * @param priority    ordering key
 */
public record NormalizationRule(String name, Pattern pattern, String replacement, int priority) {

    public NormalizationRule {
        Objects.requireNonNull(name, "name is required");
        Objects.requireNonNull(pattern, "pattern is required");
        Objects.requireNonNull(replacement, "replacement is required");
    }

    public static NormalizationRule of(String name, int priority, String regex, String replacement) {
        return new NormalizationRule(name,
                Pattern.compile(regex, Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE),
                replacement, priority);
    }

    public String apply(String text) {
        return pattern.matcher(text).replaceAll(replacement);
    }
}
