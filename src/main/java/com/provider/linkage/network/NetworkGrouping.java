package com.provider.linkage.network;

import com.provider.linkage.core.model.Network;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Networks materialized in a run and the membership of each organization.
 *
 * @param networks    networks sorted by id
 * @param assignments membership keyed by org id
 */
public record NetworkGrouping(List<Network> networks, Map<String, NetworkAssignment> assignments) {
    public NetworkGrouping {
        networks = List.copyOf(networks);
        assignments = Collections.unmodifiableMap(new TreeMap<>(assignments));
    }

    public Optional<NetworkAssignment> assignmentFor(String orgId) {
        return Optional.ofNullable(assignments.get(orgId));
    }
}
