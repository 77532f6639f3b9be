package com.contact.resolution.core.model;

/**
 * Discrete strength of an identity match, ordered from weakest to strongest.
 */
public enum MatchConfidence {
    /**
     * No candidate qualified. A new contact is created.
     */
    NONE,

    /**
     * Ambiguous multi-match. A new contact is created and the candidate is flagged for review.
     */
    LOW,

    /**
     * Name-based match (fuzzy name, optionally corroborated by company).
     */
    MEDIUM,

    /**
     * Email alias or phone-plus-name match.
     */
    HIGH,

    /**
     * Normalized email equality.
     */
    EXACT;

    /**
     * Returns true if a match at this tier may be merged into the existing contact.
     */
    public boolean allowsMerge() {
        return this == MEDIUM || this == HIGH || this == EXACT;
    }

    public boolean isAtLeast(MatchConfidence other) {
        return compareTo(other) >= 0;
    }
}
