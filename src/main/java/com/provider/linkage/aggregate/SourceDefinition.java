package com.provider.linkage.aggregate;

import com.provider.linkage.core.model.ConfidenceTier;

import java.util.Objects;

/**
 * A declared data source and the confidence tier its values carry.
 *
 * @param name source name as it appears on metric records
 * @param tier confidence of values won by this source; never MISSING
 */
public record SourceDefinition(String name, ConfidenceTier tier) {
    public SourceDefinition {
        Objects.requireNonNull(name, "name is required");
        Objects.requireNonNull(tier, "tier is required");
        if (tier == ConfidenceTier.MISSING) {
            throw new IllegalArgumentException("Source " + name + " cannot declare tier MISSING");
        }
    }
}
