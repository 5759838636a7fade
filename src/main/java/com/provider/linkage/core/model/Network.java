package com.provider.linkage.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Cluster of sibling organizations sharing a normalized brand name.
 * Only materialized for multi-state groups or same-state groups of three or more sites.
 */
public record Network(
        String networkId,
        String normalizedNetworkName,
        List<String> memberOrgIds,
        List<String> stateSet,
        String anchorOrgId,
        double networkScore,
        Map<String, Double> categoryScores,
        int tier,
        String tierLabel,
        Segment dominantSegment,
        double totalSiteWeight
) {
    public Network {
        Objects.requireNonNull(networkId, "networkId is required");
        Objects.requireNonNull(normalizedNetworkName, "normalizedNetworkName is required");
        memberOrgIds = List.copyOf(memberOrgIds);
        stateSet = List.copyOf(stateSet);
        categoryScores = Collections.unmodifiableMap(new LinkedHashMap<>(categoryScores));
        if (memberOrgIds.size() < 2) {
            throw new IllegalArgumentException("A network needs at least two members");
        }
        if (!satisfiesMaterializationRule(stateSet.size(), memberOrgIds.size())) {
            throw new IllegalArgumentException("Network spans " + stateSet.size() + " state(s) with "
                    + memberOrgIds.size() + " members");
        }
        if (!memberOrgIds.contains(anchorOrgId)) {
            throw new IllegalArgumentException("Anchor " + anchorOrgId + " is not a member");
        }
    }

    /**
     * Multi-state, or at least three sites in one state. Grouping passes only the members with a
     * known state as {@code memberCount}.
     */
    public static boolean satisfiesMaterializationRule(int stateCount, int memberCount) {
        if (memberCount < 2) {
            return false;
        }
        return stateCount >= 2 || (stateCount == 1 && memberCount >= 3);
    }

    public int memberCount() {
        return memberOrgIds.size();
    }
}
