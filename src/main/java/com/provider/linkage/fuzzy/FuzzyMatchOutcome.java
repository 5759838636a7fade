package com.provider.linkage.fuzzy;

/**
 * Result classification of a fuzzy name match.
 */
public enum FuzzyMatchOutcome {
    /**
     * A unique best candidate scored at or above the threshold.
     */
    MATCHED,

    /**
     * The best candidate scored below the threshold.
     */
    BELOW_THRESHOLD,

    /**
     * Several candidates shared the best score; no link is made.
     */
    TIE,

    /**
     * No organization exists in the record's state.
     */
    NO_CANDIDATES
}
