package com.provider.linkage.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Versioned, explainable score of one organization.
 *
 * @param orgId          scored organization
 * @param totalScore     sum of category scores, clamped to the ruleset's global maximum
 * @param categoryScores points per category in ruleset order
 * @param tier           ordinal tier, 1 is the highest priority
 * @param tierLabel      tier display label
 * @param rulesetVersion version of the scoring rules that produced this record
 * @param bibliography   audit trail, in category order
 */
public record ScoreRecord(
        String orgId,
        double totalScore,
        Map<String, Double> categoryScores,
        int tier,
        String tierLabel,
        String rulesetVersion,
        List<BibliographyEntry> bibliography
) {
    public ScoreRecord {
        Objects.requireNonNull(orgId, "orgId is required");
        Objects.requireNonNull(rulesetVersion, "rulesetVersion is required");
        categoryScores = Collections.unmodifiableMap(new LinkedHashMap<>(categoryScores));
        bibliography = List.copyOf(bibliography);
    }

    public double categoryScore(String category) {
        Double points = categoryScores.get(category);
        return points != null ? points : 0.0;
    }

    public List<BibliographyEntry> entriesFor(String category) {
        return bibliography.stream()
                .filter(e -> e.category().equals(category))
                .toList();
    }
}
