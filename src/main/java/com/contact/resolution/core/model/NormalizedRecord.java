package com.contact.resolution.core.model;

import com.contact.resolution.core.model.event.Event;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Canonicalized incoming record. Produced by the normalizer and consumed by the
 * resolver and merge engine; comparison keys are precomputed.
 *
 * @param name           display name, trimmed with whitespace collapsed
 * @param nameKey        case-insensitive comparison key for the name
 * @param email          trimmed, lowercased email; {@code null} when absent
 * @param phone          comparison digits (10 digits for North American numbers)
 * @param phoneDisplay   the phone as originally formatted
 * @param companyDerived true when the company was inferred from the email domain
 */
public record NormalizedRecord(
        SourcePlatform sourcePlatform,
        String sourceRecordId,
        String name,
        String nameKey,
        String email,
        String phone,
        String phoneDisplay,
        String company,
        boolean companyDerived,
        String title,
        String notes,
        Instant createdAt,
        Instant lastActivityDate,
        String assignedOwner,
        List<Event> events
) {
    public NormalizedRecord {
        Objects.requireNonNull(sourcePlatform, "sourcePlatform is required");
        events = events != null ? List.copyOf(events) : List.of();
    }

    public boolean hasEmail() {
        return email != null;
    }

    public boolean hasPhone() {
        return phone != null;
    }

    public boolean hasName() {
        return nameKey != null;
    }

    /**
     * Timestamp used for note provenance: last activity if known, else creation time.
     */
    public Instant observedAt() {
        return lastActivityDate != null ? lastActivityDate : createdAt;
    }

    /**
     * Key used to serialize concurrent resolution of records describing the same person.
     */
    public String identityKey() {
        if (email != null) {
            return "email:" + email;
        }
        if (phone != null) {
            return "phone:" + phone;
        }
        return "name:" + nameKey;
    }

    public String reference() {
        return sourcePlatform.tag() + ":" + (sourceRecordId != null ? sourceRecordId : identityKey());
    }
}
