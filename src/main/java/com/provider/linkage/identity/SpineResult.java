package com.provider.linkage.identity;

import java.util.List;
import java.util.Objects;

/**
 * Output of the sequential spine pass.
 *
 * @param spine                organizations keyed by primary identifier
 * @param parked               records without a primary identifier, in source order
 * @param discardedIndividuals individual-type records excluded from the spine
 * @param rejected             malformed records
 * @param collisions           identifier collisions detected
 */
public record SpineResult(
        OrganizationSpine spine,
        List<ParkedRecord> parked,
        int discardedIndividuals,
        int rejected,
        int collisions
) {
    public SpineResult {
        Objects.requireNonNull(spine, "spine is required");
        parked = parked != null ? List.copyOf(parked) : List.of();
    }
}
