package com.contact.resolution.core.model;

import com.contact.resolution.core.model.event.Event;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Contact-shaped record as delivered by a platform fetcher, before normalization.
 * Any field may be missing; {@link #events()} are the touchpoints that arrived with it.
 */
public record RawContactRecord(
        SourcePlatform sourcePlatform,
        String sourceRecordId,
        String name,
        String email,
        String phone,
        String company,
        String title,
        String notes,
        Instant createdAt,
        Instant lastActivityDate,
        String assignedOwner,
        List<Event> events
) {
    public RawContactRecord {
        events = events != null ? List.copyOf(events) : List.of();
    }

    /**
     * Human-readable reference used in logs and batch error reports.
     */
    public String reference() {
        String platform = sourcePlatform != null ? sourcePlatform.tag() : "unknown";
        if (sourceRecordId != null) {
            return platform + ":" + sourceRecordId;
        }
        if (email != null && !email.isBlank()) {
            return platform + ":" + email.trim();
        }
        return platform + ":" + (name != null ? name.trim() : "?");
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private SourcePlatform sourcePlatform;
        private String sourceRecordId;
        private String name;
        private String email;
        private String phone;
        private String company;
        private String title;
        private String notes;
        private Instant createdAt;
        private Instant lastActivityDate;
        private String assignedOwner;
        private final List<Event> events = new ArrayList<>();

        public Builder sourcePlatform(SourcePlatform sourcePlatform) {
            this.sourcePlatform = sourcePlatform;
            return this;
        }

        public Builder sourceRecordId(String sourceRecordId) {
            this.sourceRecordId = sourceRecordId;
            return this;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder email(String email) {
            this.email = email;
            return this;
        }

        public Builder phone(String phone) {
            this.phone = phone;
            return this;
        }

        public Builder company(String company) {
            this.company = company;
            return this;
        }

        public Builder title(String title) {
            this.title = title;
            return this;
        }

        public Builder notes(String notes) {
            this.notes = notes;
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public Builder lastActivityDate(Instant lastActivityDate) {
            this.lastActivityDate = lastActivityDate;
            return this;
        }

        public Builder assignedOwner(String assignedOwner) {
            this.assignedOwner = assignedOwner;
            return this;
        }

        public Builder event(Event event) {
            this.events.add(event);
            return this;
        }

        public Builder events(List<? extends Event> events) {
            this.events.addAll(events);
            return this;
        }

        public RawContactRecord build() {
            return new RawContactRecord(sourcePlatform, sourceRecordId, name, email, phone, company,
                    title, notes, createdAt, lastActivityDate, assignedOwner, events);
        }
    }
}
