package com.provider.linkage.rules;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Applies normalization rules to organization names.
 * Input is lowercased and trimmed first; rules run in priority order (lower number first);
 * whitespace is collapsed at the end.
 *
 * <p>Engines are immutable once built and safe to share between worker threads.</p>
 */
public class NormalizationEngine {
    private static final Logger log = LoggerFactory.getLogger(NormalizationEngine.class);
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private final List<NormalizationRule> rules;

    public NormalizationEngine(List<NormalizationRule> rules) {
        List<NormalizationRule> sorted = new ArrayList<>(rules);
        sorted.sort(Comparator.comparingInt(NormalizationRule::getPriority));
        this.rules = List.copyOf(sorted);
    }

    /**
     * Gets all rules in application order.
     */
    public List<NormalizationRule> getRules() {
        return rules;
    }

    /**
     * Creates a new engine with an additional rule.
     */
    public NormalizationEngine withRule(NormalizationRule rule) {
        List<NormalizationRule> extended = new ArrayList<>(rules);
        extended.add(rule);
        return new NormalizationEngine(extended);
    }

    /**
     * Normalizes the given name. Null and blank input normalize to the empty string.
     */
    public String normalize(String name) {
        if (name == null || name.isBlank()) {
            return "";
        }

        String result = name.toLowerCase(Locale.ROOT).trim();

        for (NormalizationRule rule : rules) {
            String before = result;
            result = rule.apply(result).trim();
            if (log.isTraceEnabled() && !before.equals(result)) {
                log.trace("Rule '{}' transformed '{}' -> '{}'", rule.getName(), before, result);
            }
        }

        return WHITESPACE.matcher(result).replaceAll(" ").trim();
    }

    /**
     * Checks if two names are equivalent after normalization.
     */
    public boolean areEquivalent(String name1, String name2) {
        return normalize(name1).equals(normalize(name2));
    }
}
