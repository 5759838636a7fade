package com.provider.linkage.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;
import java.util.Objects;

/**
 * Points awarded from an available input.
 *
 * @param category      scoring category
 * @param component     component within the category
 * @param sources       cited inputs, never empty
 * @param inputValue    rendered input value
 * @param pointsAwarded points contributed
 * @param explanation   human-readable reason
 */
@JsonPropertyOrder({"category", "component", "sources", "inputValue", "pointsAwarded", "explanation", "missing"})
public record AvailableEntry(
        String category,
        String component,
        List<String> sources,
        String inputValue,
        double pointsAwarded,
        String explanation
) implements BibliographyEntry {
    public AvailableEntry {
        Objects.requireNonNull(category, "category is required");
        Objects.requireNonNull(component, "component is required");
        sources = sources != null ? List.copyOf(sources) : List.of();
        if (sources.isEmpty()) {
            throw new IllegalArgumentException("An available entry must cite at least one source");
        }
        if (pointsAwarded < 0.0) {
            throw new IllegalArgumentException("pointsAwarded must be non-negative");
        }
    }

    @Override
    @JsonProperty("missing")
    public boolean missing() {
        return false;
    }
}
