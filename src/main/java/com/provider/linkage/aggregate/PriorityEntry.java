package com.provider.linkage.aggregate;

import java.util.Objects;

/**
 * One step of a metric's hierarchy of truth.
 *
 * @param sourceName source contributing the metric
 * @param rank       lower ranks win
 * @param multiplier applied to the value when this source wins (e.g. claims revenue scaled to
 *                   total revenue)
 */
public record PriorityEntry(String sourceName, int rank, double multiplier) {
    public PriorityEntry {
        Objects.requireNonNull(sourceName, "sourceName is required");
        if (rank < 1) {
            throw new IllegalArgumentException("rank must be >= 1");
        }
        if (!(multiplier > 0.0) || Double.isInfinite(multiplier)) {
            throw new IllegalArgumentException("multiplier must be a positive finite number");
        }
    }
}
