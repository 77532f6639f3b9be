package com.contact.resolution.core.model;

import java.time.Instant;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;

/**
 * A deduplicated person record.
 * Instances are immutable; merges produce a new instance carrying the same id.
 */
public class Contact {
    private final String id;
    private final String name;
    private final String email;
    private final String phone;
    private final String company;
    private final String title;
    private final Set<SourcePlatform> leadSources;
    private final String notes;
    private final Instant createdAt;
    private final Instant lastActivityDate;
    private final String assignedOwner;

    private Contact(Builder builder) {
        this.id = builder.id != null ? builder.id : UUID.randomUUID().toString();
        this.name = builder.name;
        this.email = builder.email;
        this.phone = builder.phone;
        this.company = builder.company;
        this.title = builder.title;
        this.leadSources = builder.leadSources.isEmpty()
                ? Collections.emptySet()
                : Collections.unmodifiableSet(EnumSet.copyOf(builder.leadSources));
        this.notes = builder.notes;
        this.createdAt = builder.createdAt != null ? builder.createdAt : Instant.now();
        this.lastActivityDate = builder.lastActivityDate;
        this.assignedOwner = builder.assignedOwner;
    }

    public String getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public String getEmail() {
        return email;
    }

    public String getPhone() {
        return phone;
    }

    public String getCompany() {
        return company;
    }

    public String getTitle() {
        return title;
    }

    public Set<SourcePlatform> getLeadSources() {
        return leadSources;
    }

    /**
     * Number of platforms this contact has been seen on. Always {@code |leadSources|}.
     */
    public int getSourcesCount() {
        return leadSources.size();
    }

    public String getNotes() {
        return notes;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Instant getLastActivityDate() {
        return lastActivityDate;
    }

    public String getAssignedOwner() {
        return assignedOwner;
    }

    public boolean hasEmail() {
        return email != null && !email.isEmpty();
    }

    public boolean hasName() {
        return name != null && !name.isBlank();
    }

    /**
     * Returns the value of a scalar identity field.
     */
    public String get(ContactField field) {
        return switch (field) {
            case NAME -> name;
            case EMAIL -> email;
            case PHONE -> phone;
            case COMPANY -> company;
            case TITLE -> title;
        };
    }

    /**
     * Compares every field, unlike {@link #equals(Object)} which compares identity only.
     */
    public boolean sameStateAs(Contact other) {
        if (other == null) return false;
        return Objects.equals(id, other.id)
                && Objects.equals(name, other.name)
                && Objects.equals(email, other.email)
                && Objects.equals(phone, other.phone)
                && Objects.equals(company, other.company)
                && Objects.equals(title, other.title)
                && Objects.equals(leadSources, other.leadSources)
                && Objects.equals(notes, other.notes)
                && Objects.equals(createdAt, other.createdAt)
                && Objects.equals(lastActivityDate, other.lastActivityDate)
                && Objects.equals(assignedOwner, other.assignedOwner);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Contact contact = (Contact) o;
        return Objects.equals(id, contact.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "Contact{" +
                "id='" + id + '\'' +
                ", name='" + name + '\'' +
                ", email='" + email + '\'' +
                ", phone='" + phone + '\'' +
                ", company='" + company + '\'' +
                ", leadSources=" + leadSources +
                '}';
    }

    public static Builder builder() {
        return new Builder();
    }

    public static Builder builder(Contact contact) {
        return new Builder()
                .id(contact.id)
                .name(contact.name)
                .email(contact.email)
                .phone(contact.phone)
                .company(contact.company)
                .title(contact.title)
                .leadSources(contact.leadSources)
                .notes(contact.notes)
                .createdAt(contact.createdAt)
                .lastActivityDate(contact.lastActivityDate)
                .assignedOwner(contact.assignedOwner);
    }

    public static class Builder {
        private String id;
        private String name;
        private String email;
        private String phone;
        private String company;
        private String title;
        private final Set<SourcePlatform> leadSources = EnumSet.noneOf(SourcePlatform.class);
        private String notes;
        private Instant createdAt;
        private Instant lastActivityDate;
        private String assignedOwner;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        /**
         * Sets the email. Blank strings are stored as {@code null}.
         */
        public Builder email(String email) {
            this.email = email == null || email.isBlank() ? null : email;
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

        public Builder leadSources(Set<SourcePlatform> sources) {
            this.leadSources.clear();
            if (sources != null) {
                this.leadSources.addAll(sources);
            }
            return this;
        }

        public Builder leadSource(SourcePlatform source) {
            this.leadSources.add(Objects.requireNonNull(source, "source is required"));
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

        public Builder set(ContactField field, String value) {
            switch (field) {
                case NAME -> name(value);
                case EMAIL -> email(value);
                case PHONE -> phone(value);
                case COMPANY -> company(value);
                case TITLE -> title(value);
            }
            return this;
        }

        public Contact build() {
            return new Contact(this);
        }
    }
}
