package com.contact.resolution.core.model;

import java.util.Objects;

/**
 * Outcome of identity resolution for one incoming record. Never persisted.
 *
 * @param contact    the matched existing contact, or null when no candidate qualified
 * @param confidence discrete match tier
 * @param reason     human-readable explanation, including ambiguity details for review
 * @param score      the name similarity that decided a fuzzy match, 1.0 for identifier matches
 */
public record MatchResult(
        Contact contact,
        MatchConfidence confidence,
        String reason,
        double score
) {
    public MatchResult {
        Objects.requireNonNull(confidence, "confidence is required");
        if (score < 0.0 || score > 1.0) {
            throw new IllegalArgumentException("Score must be between 0.0 and 1.0");
        }
        if (confidence == MatchConfidence.NONE && contact != null) {
            throw new IllegalArgumentException("A NONE result cannot carry a contact");
        }
        if (confidence != MatchConfidence.NONE && contact == null) {
            throw new IllegalArgumentException(confidence + " result requires a contact");
        }
    }

    /**
     * Creates a no-match result.
     */
    public static MatchResult noMatch(String reason) {
        return new MatchResult(null, MatchConfidence.NONE, reason, 0.0);
    }

    public static MatchResult of(Contact contact, MatchConfidence confidence, String reason) {
        return new MatchResult(contact, confidence, reason, 1.0);
    }

    public static MatchResult of(Contact contact, MatchConfidence confidence, String reason, double score) {
        return new MatchResult(contact, confidence, reason, score);
    }

    public boolean hasMatch() {
        return contact != null;
    }

    /**
     * Returns true if the merge engine may write to the matched contact.
     */
    public boolean allowsMerge() {
        return confidence.allowsMerge();
    }

    /**
     * Returns true if this result must be surfaced for manual review.
     */
    public boolean requiresReview() {
        return confidence == MatchConfidence.LOW;
    }
}
