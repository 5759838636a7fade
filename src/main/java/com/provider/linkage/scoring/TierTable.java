package com.provider.linkage.scoring;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Maps a total score to its tier. Rules are checked from the highest {@code minScore} down;
 * the lowest rule must start at 0 so every score has a tier.
 */
public final class TierTable {

    private final List<TierRule> rules;

    public TierTable(List<TierRule> rules) {
        if (rules == null || rules.isEmpty()) {
            throw new IllegalArgumentException("At least one tier is required");
        }
        List<TierRule> sorted = new ArrayList<>(rules);
        sorted.sort(Comparator.comparingDouble(TierRule::minScore).reversed());
        if (sorted.get(sorted.size() - 1).minScore() > 0.0) {
            throw new IllegalArgumentException("The lowest tier must start at 0");
        }
        for (int i = 1; i < sorted.size(); i++) {
            if (sorted.get(i).tier() <= sorted.get(i - 1).tier()) {
                throw new IllegalArgumentException("Tier ordinals must increase as minScore decreases");
            }
        }
        this.rules = List.copyOf(sorted);
    }

    public TierRule tierFor(double score) {
        for (TierRule rule : rules) {
            if (score >= rule.minScore()) {
                return rule;
            }
        }
        return rules.get(rules.size() - 1);
    }

    public List<TierRule> getRules() {
        return rules;
    }
}
