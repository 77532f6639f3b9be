package com.contact.resolution.review;

/**
 * Why a contact was surfaced for manual review.
 */
public enum ReviewReason {
    /**
     * Several existing contacts matched the same signal; a new contact was created instead of merging.
     */
    AMBIGUOUS_MATCH,

    /**
     * A merge kept the existing email and ignored a different incoming one.
     */
    EMAIL_CONFLICT
}
