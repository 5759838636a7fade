package com.provider.linkage.identity;

import com.provider.linkage.core.model.Organization;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * The set of canonical organizations of a run, indexed by org id and by primary identifier.
 *
 * <p>Organizations are only added by the sequential stages of the pipeline; parallel stages read
 * the spine and mutate individual organizations, never the spine itself.</p>
 */
public class OrganizationSpine {

    private final TreeMap<String, Organization> byOrgId = new TreeMap<>();
    private final Map<String, Organization> byPrimaryIdentifier = new HashMap<>();

    /**
     * Adds an organization.
     *
     * @throws IllegalStateException if the org id or primary identifier is already taken
     */
    public void add(Organization organization) {
        if (byOrgId.containsKey(organization.getOrgId())) {
            throw new IllegalStateException("Duplicate orgId " + organization.getOrgId());
        }
        if (organization.hasPrimaryIdentifier()) {
            Organization previous = byPrimaryIdentifier.putIfAbsent(organization.getPrimaryIdentifier(), organization);
            if (previous != null) {
                throw new IllegalStateException("Primary identifier " + organization.getPrimaryIdentifier()
                        + " already belongs to " + previous.getOrgId());
            }
        }
        byOrgId.put(organization.getOrgId(), organization);
    }

    public Optional<Organization> get(String orgId) {
        return Optional.ofNullable(byOrgId.get(orgId));
    }

    public Optional<Organization> findByPrimaryIdentifier(String primaryIdentifier) {
        if (primaryIdentifier == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(byPrimaryIdentifier.get(primaryIdentifier));
    }

    public boolean contains(String orgId) {
        return byOrgId.containsKey(orgId);
    }

    /**
     * Organizations sorted by org id.
     */
    public List<Organization> organizations() {
        return Collections.unmodifiableList(new ArrayList<>(byOrgId.values()));
    }

    public Collection<String> orgIds() {
        return Collections.unmodifiableSet(byOrgId.navigableKeySet());
    }

    public int size() {
        return byOrgId.size();
    }

    public void sealAll() {
        byOrgId.values().forEach(Organization::seal);
    }
}
