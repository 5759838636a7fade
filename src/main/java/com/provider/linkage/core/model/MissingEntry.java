package com.provider.linkage.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;
import java.util.Objects;

/**
 * Records that a component had no usable input and contributed its floor value.
 */
@JsonPropertyOrder({"category", "component", "sources", "note", "pointsAwarded", "missing"})
public record MissingEntry(
        String category,
        String component,
        List<String> sources,
        String note
) implements BibliographyEntry {
    public MissingEntry {
        Objects.requireNonNull(category, "category is required");
        Objects.requireNonNull(component, "component is required");
        sources = sources != null ? List.copyOf(sources) : List.of();
    }

    @Override
    @JsonProperty("missing")
    public boolean missing() {
        return true;
    }

    @Override
    @JsonProperty("pointsAwarded")
    public double pointsAwarded() {
        return 0.0;
    }
}
