package com.contact.resolution.audit;

/**
 * Types of auditable actions on contacts.
 */
public enum AuditAction {
    CONTACT_CREATED,
    CONTACT_MERGED,
    MERGE_CONFLICT,
    EVENT_LINKED,
    MANUAL_REVIEW_REQUESTED,
    MANUAL_REVIEW_COMPLETED
}
