package com.contact.resolution.merge;

import com.contact.resolution.core.model.Contact;

import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Result of merging one record into a contact.
 *
 * @param contact       the merged contact, same id as the input
 * @param changedFields names of the fields whose value changed, empty when the merge was a no-op
 * @param warnings      conflicts that were logged and skipped
 */
public record MergeResult(
        Contact contact,
        Set<String> changedFields,
        List<MergeConflictWarning> warnings
) {
    public MergeResult {
        Objects.requireNonNull(contact, "contact is required");
        changedFields = changedFields != null ? Set.copyOf(changedFields) : Set.of();
        warnings = warnings != null ? List.copyOf(warnings) : List.of();
    }

    public boolean isChanged() {
        return !changedFields.isEmpty();
    }

    public boolean hasConflicts() {
        return !warnings.isEmpty();
    }
}
