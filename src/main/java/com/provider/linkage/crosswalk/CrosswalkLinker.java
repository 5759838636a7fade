package com.provider.linkage.crosswalk;

import com.provider.linkage.core.model.LinkEdge;
import com.provider.linkage.core.model.MetricRecord;
import com.provider.linkage.core.model.Organization;
import com.provider.linkage.identity.OrganizationSpine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Attaches metric records to organizations through exact identifiers and crosswalk tables.
 *
 * <p>Never throws for an unlinkable record: an empty result means the record falls through to
 * the fuzzy matcher. Reads the spine only, so one instance is shared by all workers.</p>
 */
public class CrosswalkLinker {
    private static final Logger log = LoggerFactory.getLogger(CrosswalkLinker.class);

    private final OrganizationSpine spine;

    public CrosswalkLinker(OrganizationSpine spine) {
        this.spine = Objects.requireNonNull(spine, "spine is required");
    }

    /**
     * Links a record that carries the registry's primary identifier directly.
     *
     * @return the exact edge, or empty when the record has no identifier or it is not in the spine
     */
    public Optional<LinkEdge> linkExact(MetricRecord record) {
        if (!record.hasPrimaryIdentifier()) {
            return Optional.empty();
        }
        return spine.findByPrimaryIdentifier(record.primaryIdentifier())
                .map(org -> LinkEdge.exact(org.getOrgId(), record.sourceName(), record.recordKey()));
    }

    /**
     * Links a record through {@code table}, one edge per mapped organization present in the spine.
     * Edges are ordered by primary identifier.
     *
     * @return the edges, empty when the record's key space differs from the table's or nothing maps
     */
    public List<LinkEdge> link(MetricRecord record, CrosswalkTable table) {
        if (table == null || !record.hasForeignKey() || !table.getKeySpace().equals(record.keySpace())) {
            return List.of();
        }
        List<LinkEdge> edges = new ArrayList<>();
        for (String primaryIdentifier : table.lookup(record.foreignKey())) {
            Optional<Organization> org = spine.findByPrimaryIdentifier(primaryIdentifier);
            if (org.isPresent()) {
                edges.add(LinkEdge.crosswalk(org.get().getOrgId(), record.sourceName(), record.recordKey()));
            } else {
                log.trace("crosswalk.unmapped keySpace={} foreignKey={} primaryIdentifier={}",
                        table.getKeySpace(), record.foreignKey(), primaryIdentifier);
            }
        }
        return edges;
    }
}
