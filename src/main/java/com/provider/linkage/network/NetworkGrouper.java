package com.provider.linkage.network;

import com.provider.linkage.core.model.Network;
import com.provider.linkage.core.model.Segment;
import com.provider.linkage.scoring.TierRule;
import com.provider.linkage.scoring.TierTable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeSet;

/**
 * Groups sibling organizations sharing a normalized name into networks.
 *
 * <p>One pass buckets members by name, then each bucket is reduced on its own, so the work is
 * linear in the number of organizations. A bucket becomes a network when it spans at least two
 * states, or has at least three members in a single state.</p>
 */
public class NetworkGrouper {
    private static final Logger log = LoggerFactory.getLogger(NetworkGrouper.class);

    private static final Comparator<NetworkMember> ANCHOR_ORDER = Comparator
            .comparingDouble(NetworkMember::totalScore).reversed()
            .thenComparing(NetworkMember::orgId);

    private final TierTable tiers;

    public NetworkGrouper(TierTable tiers) {
        this.tiers = Objects.requireNonNull(tiers, "tiers is required");
    }

    public NetworkGrouping group(List<NetworkMember> members) {
        Map<String, List<NetworkMember>> byName = new HashMap<>();
        for (NetworkMember member : members) {
            if (member.normalizedName().isEmpty()) {
                continue;
            }
            byName.computeIfAbsent(member.normalizedName(), k -> new ArrayList<>()).add(member);
        }

        List<Network> networks = new ArrayList<>();
        Map<String, NetworkAssignment> assignments = new HashMap<>();
        for (Map.Entry<String, List<NetworkMember>> bucket : byName.entrySet()) {
            List<NetworkMember> group = bucket.getValue();
            if (group.size() < 2) {
                continue;
            }
            TreeSet<String> states = new TreeSet<>();
            int located = 0;
            for (NetworkMember member : group) {
                if (!member.stateCode().isEmpty()) {
                    states.add(member.stateCode());
                    located++;
                }
            }
            // members without a state join a network but never count toward it
            if (!Network.satisfiesMaterializationRule(states.size(), located)) {
                continue;
            }
            Network network = reduce(bucket.getKey(), group, states);
            networks.add(network);
            for (String orgId : network.memberOrgIds()) {
                assignments.put(orgId, new NetworkAssignment(orgId, network.networkId(),
                        orgId.equals(network.anchorOrgId())));
            }
        }
        networks.sort(Comparator.comparing(Network::networkId));
        log.info("network.grouped candidates={} nameGroups={} networks={} members={}",
                members.size(), byName.size(), networks.size(), assignments.size());
        return new NetworkGrouping(networks, assignments);
    }

    private Network reduce(String name, List<NetworkMember> group, TreeSet<String> states) {
        List<NetworkMember> sorted = new ArrayList<>(group);
        sorted.sort(Comparator.comparing(NetworkMember::orgId));

        double totalWeight = 0.0;
        double weightedScore = 0.0;
        Map<String, Double> weightedCategories = new LinkedHashMap<>();
        Map<Segment, Integer> segmentCounts = new EnumMap<>(Segment.class);
        for (NetworkMember member : sorted) {
            double weight = member.weight();
            totalWeight += weight;
            weightedScore += weight * member.totalScore();
            member.categoryScores().forEach((category, points) ->
                    weightedCategories.merge(category, weight * points, Double::sum));
            if (member.segment() != null) {
                segmentCounts.merge(member.segment(), 1, Integer::sum);
            }
        }

        double networkScore = round(weightedScore / totalWeight);
        Map<String, Double> categoryScores = new LinkedHashMap<>();
        for (Map.Entry<String, Double> entry : weightedCategories.entrySet()) {
            categoryScores.put(entry.getKey(), round(entry.getValue() / totalWeight));
        }
        NetworkMember anchor = sorted.stream().min(ANCHOR_ORDER).orElseThrow();
        TierRule tier = tiers.tierFor(networkScore);

        return new Network(
                NetworkIdGenerator.forName(name),
                name,
                sorted.stream().map(NetworkMember::orgId).toList(),
                new ArrayList<>(states),
                anchor.orgId(),
                networkScore,
                categoryScores,
                tier.tier(),
                tier.label(),
                dominantSegment(segmentCounts),
                totalWeight);
    }

    /**
     * Most frequent segment; EnumMap iterates A to D, so the first maximum wins ties by letter.
     */
    private static Segment dominantSegment(Map<Segment, Integer> counts) {
        Segment dominant = null;
        int best = 0;
        for (Map.Entry<Segment, Integer> entry : counts.entrySet()) {
            if (entry.getValue() > best) {
                best = entry.getValue();
                dominant = entry.getKey();
            }
        }
        return dominant;
    }

    private static double round(double value) {
        return BigDecimal.valueOf(value).setScale(2, RoundingMode.HALF_UP).doubleValue();
    }
}
