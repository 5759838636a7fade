package com.provider.linkage.rules;

import java.util.ArrayList;
import java.util.List;

/**
 * Built-in rules for healthcare organization names as they appear in registry, claims and
 * cost-report files.
 */
public final class DefaultNormalizationRules {

    /**
     * Legal-entity suffixes stripped when they are the trailing token. Dotted variants
     * ("L.L.C.", "P.A.") reach the suffix rule already collapsed by the dot rule.
     */
    public static final List<String> LEGAL_SUFFIXES = List.of(
            "inc", "incorporated",
            "llc", "pllc",
            "corp", "corporation",
            "ltd", "limited",
            "pa", "pc", "lp", "llp",
            "co", "company"
    );

    private DefaultNormalizationRules() {
        // Utility class
    }

    /**
     * Creates an engine with every default rule.
     */
    public static NormalizationEngine createDefaultEngine() {
        List<NormalizationRule> rules = new ArrayList<>();
        rules.addAll(getPunctuationRules());
        rules.addAll(getSuffixRules());
        return new NormalizationEngine(rules);
    }

    /**
     * Punctuation handling: dots and apostrophes are dropped so that abbreviations collapse
     * ("L.L.C." to "llc", "St. Mary's" to "st marys"); hyphens survive only between letters or
     * digits; everything else that is not a letter, digit or whitespace becomes a space.
     */
    public static List<NormalizationRule> getPunctuationRules() {
        return List.of(
                NormalizationRule.builder()
                        .name("punct-dots-apostrophes")
                        .pattern("[.'’`]")
                        .replacement("")
                        .priority(10)
                        .build(),

                NormalizationRule.builder()
                        .name("punct-edge-hyphens")
                        .pattern("(?<![\\p{L}\\p{N}])-|-(?![\\p{L}\\p{N}])")
                        .replacement(" ")
                        .priority(20)
                        .build(),

                NormalizationRule.builder()
                        .name("punct-other")
                        .pattern("[^\\p{L}\\p{N}\\s-]")
                        .replacement(" ")
                        .priority(30)
                        .build(),

                NormalizationRule.builder()
                        .name("collapse-spaces")
                        .pattern("\\s+")
                        .replacement(" ")
                        .priority(40)
                        .build()
        );
    }

    /**
     * Trailing legal-suffix removal. The leading whitespace in the pattern keeps a name that
     * consists only of a suffix-like token (for example a practice literally named "PA") intact.
     */
    public static List<NormalizationRule> getSuffixRules() {
        String alternatives = String.join("|", LEGAL_SUFFIXES);
        return List.of(
                NormalizationRule.builder()
                        .name("legal-suffix")
                        .pattern("\\s+(?:" + alternatives + ")\\s*$")
                        .replacement("")
                        .priority(50)
                        .repeatUntilStable(true)
                        .build()
        );
    }
}
