package com.provider.linkage.core.model;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;

/**
 * One line of a score's audit trail. Either an {@link AvailableEntry} explaining points that
 * were awarded from real inputs, or a {@link MissingEntry} recording that an input was absent.
 */
@JsonPropertyOrder({"category", "component", "sources", "missing"})
public interface BibliographyEntry {

    /**
     * Scoring category the entry belongs to, e.g. {@code economic_pain}.
     */
    String category();

    /**
     * Component within the category, e.g. {@code revenue_leakage}.
     */
    String component();

    /**
     * Metric names or attributes the entry cites.
     */
    List<String> sources();

    /**
     * True when the entry records missing input.
     */
    boolean missing();

    /**
     * Points this entry contributed.
     */
    double pointsAwarded();
}
