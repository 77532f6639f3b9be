package com.contact.resolution.merge;

import com.contact.resolution.core.model.ContactField;

import java.util.Locale;
import java.util.Objects;

/**
 * Non-fatal conflict found while merging: both sides hold different non-empty values
 * for a field the engine refuses to overwrite. The existing value is kept.
 */
public record MergeConflictWarning(
        String contactId,
        ContactField field,
        String existingValue,
        String incomingValue
) {
    public MergeConflictWarning {
        Objects.requireNonNull(contactId, "contactId is required");
        Objects.requireNonNull(field, "field is required");
    }

    public String message() {
        return String.format("%s conflict on contact %s: kept '%s', ignored '%s'",
                field.name().toLowerCase(Locale.ROOT), contactId, existingValue, incomingValue);
    }
}
