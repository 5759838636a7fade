package com.provider.linkage.network;

import com.provider.linkage.core.model.Segment;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * The scored view of one organization the grouper works on.
 *
 * @param orgId          organization id
 * @param normalizedName grouping key
 * @param stateCode      state, may be empty
 * @param segment        segment, may be {@code null}
 * @param totalScore     organization total score
 * @param categoryScores organization category scores
 * @param siteCount      resolved site count, or {@code null} when missing
 */
public record NetworkMember(
        String orgId,
        String normalizedName,
        String stateCode,
        Segment segment,
        double totalScore,
        Map<String, Double> categoryScores,
        Double siteCount
) {
    public NetworkMember {
        Objects.requireNonNull(orgId, "orgId is required");
        normalizedName = normalizedName != null ? normalizedName : "";
        stateCode = stateCode != null ? stateCode : "";
        categoryScores = categoryScores != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(categoryScores))
                : Map.of();
    }

    /**
     * Weight in network averages: the site count when positive, otherwise 1.
     */
    public double weight() {
        return siteCount != null && siteCount > 0 ? siteCount : 1.0;
    }
}
