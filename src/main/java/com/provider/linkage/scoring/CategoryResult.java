package com.provider.linkage.scoring;

import com.provider.linkage.core.model.BibliographyEntry;

import java.util.List;
import java.util.Objects;

/**
 * Points and audit entries produced by one category scorer.
 *
 * @param category category name
 * @param points   points in {@code [0, ceiling]}
 * @param entries  bibliography entries in component order
 */
public record CategoryResult(String category, double points, List<BibliographyEntry> entries) {
    public CategoryResult {
        Objects.requireNonNull(category, "category is required");
        entries = entries != null ? List.copyOf(entries) : List.of();
    }

    /**
     * Clamps raw component points to {@code [0, ceiling]}.
     */
    public static CategoryResult clamped(String category, double ceiling, double rawPoints,
                                         List<BibliographyEntry> entries) {
        double points = Math.max(0.0, Math.min(ceiling, rawPoints));
        return new CategoryResult(category, points, entries);
    }
}
