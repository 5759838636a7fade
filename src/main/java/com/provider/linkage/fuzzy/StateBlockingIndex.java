package com.provider.linkage.fuzzy;

import com.provider.linkage.core.model.Organization;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Partition of the organization spine by state code, built once per run.
 * Fuzzy candidates are always drawn from a single partition, so no string comparison ever
 * crosses a state boundary. Read-only after construction.
 */
public class StateBlockingIndex {

    private final Map<String, List<Organization>> byState;
    private final int size;

    public StateBlockingIndex(Collection<Organization> organizations) {
        Map<String, List<Organization>> partitions = new TreeMap<>();
        for (Organization org : organizations) {
            if (org.getStateCode().isEmpty()) {
                continue;
            }
            partitions.computeIfAbsent(org.getStateCode(), k -> new ArrayList<>()).add(org);
        }
        int count = 0;
        Map<String, List<Organization>> frozen = new TreeMap<>();
        for (Map.Entry<String, List<Organization>> entry : partitions.entrySet()) {
            List<Organization> members = entry.getValue();
            members.sort(Comparator.comparing(Organization::getOrgId));
            frozen.put(entry.getKey(), List.copyOf(members));
            count += members.size();
        }
        this.byState = frozen;
        this.size = count;
    }

    /**
     * Organizations in {@code stateCode}, sorted by org id. Empty for unknown or blank states.
     */
    public List<Organization> candidates(String stateCode) {
        if (stateCode == null || stateCode.isEmpty()) {
            return List.of();
        }
        return byState.getOrDefault(stateCode, List.of());
    }

    public Set<String> states() {
        return byState.keySet();
    }

    public int size() {
        return size;
    }
}
