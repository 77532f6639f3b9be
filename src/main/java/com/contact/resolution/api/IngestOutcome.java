package com.contact.resolution.api;

/**
 * What ingestion did with a record.
 */
public enum IngestOutcome {
    /**
     * No existing contact matched; a new one was created.
     */
    CREATED,

    /**
     * The record was merged into an existing contact.
     */
    MERGED,

    /**
     * Several contacts matched ambiguously; a new contact was created and filed for review.
     */
    CREATED_PENDING_REVIEW
}
