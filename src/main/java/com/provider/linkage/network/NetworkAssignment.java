package com.provider.linkage.network;

import java.util.Objects;

/**
 * Network membership of one organization.
 *
 * @param orgId           member organization
 * @param networkId       network it belongs to
 * @param isNetworkAnchor true for the network's highest-scoring member
 */
public record NetworkAssignment(String orgId, String networkId, boolean isNetworkAnchor) {
    public NetworkAssignment {
        Objects.requireNonNull(orgId, "orgId is required");
        Objects.requireNonNull(networkId, "networkId is required");
    }
}
