package com.provider.linkage.core.model;

/**
 * How a source record was attached to an organization.
 * Declaration order is the tie-break order used by the aggregator (strongest first).
 */
public enum LinkMethod {
    /**
     * The record carried the organization's primary identifier.
     */
    EXACT_ID("exact_id"),

    /**
     * The record's foreign key was mapped through a crosswalk table.
     */
    CROSSWALK("crosswalk"),

    /**
     * The record was matched by normalized name within the same state.
     */
    FUZZY("fuzzy");

    private final String code;

    LinkMethod(String code) {
        this.code = code;
    }

    public String getCode() {
        return code;
    }

    public boolean isExact() {
        return this != FUZZY;
    }
}
