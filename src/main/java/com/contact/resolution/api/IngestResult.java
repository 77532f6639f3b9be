package com.contact.resolution.api;

import com.contact.resolution.core.model.Contact;
import com.contact.resolution.core.model.MatchResult;
import com.contact.resolution.merge.MergeConflictWarning;

import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Result of ingesting one raw record.
 *
 * @param contact       the contact the record now belongs to, as committed
 * @param match         the resolver's decision
 * @param changedFields fields written by a merge; every field for a creation
 * @param warnings      merge conflicts that were skipped
 * @param reviewItemIds review items filed for this record
 */
public record IngestResult(
        IngestOutcome outcome,
        Contact contact,
        MatchResult match,
        Set<String> changedFields,
        List<MergeConflictWarning> warnings,
        List<String> reviewItemIds
) {
    public IngestResult {
        Objects.requireNonNull(outcome, "outcome is required");
        Objects.requireNonNull(contact, "contact is required");
        Objects.requireNonNull(match, "match is required");
        changedFields = changedFields != null ? Set.copyOf(changedFields) : Set.of();
        warnings = warnings != null ? List.copyOf(warnings) : List.of();
        reviewItemIds = reviewItemIds != null ? List.copyOf(reviewItemIds) : List.of();
    }

    public boolean isNewContact() {
        return outcome != IngestOutcome.MERGED;
    }

    public boolean needsReview() {
        return !reviewItemIds.isEmpty();
    }
}
