package com.provider.linkage.scoring;

import java.util.Objects;

/**
 * A tier boundary: totals at or above {@code minScore} fall in {@code tier} unless a higher
 * tier also applies.
 *
 * @param tier     ordinal, 1 is the highest priority
 * @param label    display label
 * @param minScore inclusive lower bound
 */
public record TierRule(int tier, String label, double minScore) {
    public TierRule {
        Objects.requireNonNull(label, "label is required");
        if (tier < 1) {
            throw new IllegalArgumentException("tier must be >= 1");
        }
    }
}
