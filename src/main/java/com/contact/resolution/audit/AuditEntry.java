package com.contact.resolution.audit;

import com.contact.resolution.core.model.SourcePlatform;

import java.time.Instant;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;

/**
 * Immutable record of a change to a contact.
 *
 * @param contactId       the contact the action applied to
 * @param actorId         who caused it: a source record reference, a reviewer, or {@code system}
 * @param sourcePlatform  platform of the record that caused the change, null for reviews
 * @param sourceReference {@code platform:recordId} of that record, null for reviews
 * @param changedFields   contact fields the action wrote, in write order
 * @param reviewId        review item filed or completed by the action, if any
 * @param details         action-specific values such as confidence or the conflicting values
 */
public record AuditEntry(
        String id,
        AuditAction action,
        String contactId,
        String actorId,
        SourcePlatform sourcePlatform,
        String sourceReference,
        Set<String> changedFields,
        String reviewId,
        Map<String, Object> details,
        Instant timestamp
) {
    public AuditEntry {
        Objects.requireNonNull(id, "id is required");
        Objects.requireNonNull(action, "action is required");
        Objects.requireNonNull(timestamp, "timestamp is required");
        changedFields = changedFields != null
                ? Collections.unmodifiableSet(new LinkedHashSet<>(changedFields)) : Set.of();
        details = details != null ? Map.copyOf(details) : Map.of();
    }

    public boolean hasReview() {
        return reviewId != null;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String id = UUID.randomUUID().toString();
        private AuditAction action;
        private String contactId;
        private String actorId;
        private SourcePlatform sourcePlatform;
        private String sourceReference;
        private Set<String> changedFields;
        private String reviewId;
        private Map<String, Object> details;
        private Instant timestamp = Instant.now();

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder action(AuditAction action) {
            this.action = action;
            return this;
        }

        public Builder contactId(String contactId) {
            this.contactId = contactId;
            return this;
        }

        public Builder actorId(String actorId) {
            this.actorId = actorId;
            return this;
        }

        /**
         * Sets the platform and reference of the record behind the change; the reference
         * also becomes the actor unless one was set.
         */
        public Builder source(SourcePlatform platform, String reference) {
            this.sourcePlatform = platform;
            this.sourceReference = reference;
            if (actorId == null) {
                actorId = reference;
            }
            return this;
        }

        public Builder changedFields(Collection<String> changedFields) {
            this.changedFields = changedFields != null ? new LinkedHashSet<>(changedFields) : null;
            return this;
        }

        public Builder reviewId(String reviewId) {
            this.reviewId = reviewId;
            return this;
        }

        public Builder details(Map<String, Object> details) {
            this.details = details;
            return this;
        }

        public Builder timestamp(Instant timestamp) {
            this.timestamp = timestamp;
            return this;
        }

        public AuditEntry build() {
            return new AuditEntry(id, action, contactId, actorId, sourcePlatform, sourceReference,
                    changedFields, reviewId, details, timestamp);
        }
    }
}
