package com.provider.linkage.audit;

/**
 * Kinds of record-level events written to the rejection/collision report.
 */
public enum AuditAction {
    /**
     * Record failed shape validation and was rejected.
     */
    REJECTED_MALFORMED,

    /**
     * Individual-type registry record, excluded from the organization spine.
     */
    DISCARDED_INDIVIDUAL,

    /**
     * Primary identifier seen again with materially different attributes; first-seen kept.
     */
    IDENTIFIER_COLLISION,

    /**
     * Fuzzy match tied between several candidates; no link was made.
     */
    AMBIGUOUS_LINK,

    /**
     * No exact, crosswalk or fuzzy link could be established.
     */
    UNLINKED,

    /**
     * Parked identity record without a registry match became a name-keyed organization.
     */
    CREATED_FROM_NAME,

    /**
     * Linked metric record from a source with no rank for its metric; the value was not used.
     */
    UNRANKED_CONTRIBUTION;

    /**
     * True for actions that represent a rejected input record.
     */
    public boolean isRejection() {
        return this == REJECTED_MALFORMED || this == UNLINKED || this == AMBIGUOUS_LINK;
    }
}
