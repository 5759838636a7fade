package com.provider.linkage.core.model;

import java.util.Objects;

/**
 * Audit record of one source record attached to one organization.
 *
 * @param orgId           the organization the record was attached to
 * @param sourceName      dataset the record came from
 * @param sourceRecordKey key of the record within its dataset
 * @param linkMethod      how the link was established
 * @param confidence      1.0 for exact and crosswalk links, the similarity score for fuzzy links
 */
public record LinkEdge(
        String orgId,
        String sourceName,
        String sourceRecordKey,
        LinkMethod linkMethod,
        double confidence
) {
    public LinkEdge {
        Objects.requireNonNull(orgId, "orgId is required");
        Objects.requireNonNull(sourceName, "sourceName is required");
        Objects.requireNonNull(sourceRecordKey, "sourceRecordKey is required");
        Objects.requireNonNull(linkMethod, "linkMethod is required");
        if (confidence < 0.0 || confidence > 1.0) {
            throw new IllegalArgumentException("confidence must be between 0.0 and 1.0");
        }
        if (linkMethod.isExact() && confidence != 1.0) {
            throw new IllegalArgumentException(linkMethod.getCode() + " links must have confidence 1.0");
        }
    }

    public static LinkEdge exact(String orgId, String sourceName, String recordKey) {
        return new LinkEdge(orgId, sourceName, recordKey, LinkMethod.EXACT_ID, 1.0);
    }

    public static LinkEdge crosswalk(String orgId, String sourceName, String recordKey) {
        return new LinkEdge(orgId, sourceName, recordKey, LinkMethod.CROSSWALK, 1.0);
    }

    public static LinkEdge fuzzy(String orgId, String sourceName, String recordKey, double confidence) {
        return new LinkEdge(orgId, sourceName, recordKey, LinkMethod.FUZZY, confidence);
    }

    public SourceRecordRef recordRef() {
        return new SourceRecordRef(sourceName, sourceRecordKey);
    }
}
