package com.contact.resolution.merge;

import com.contact.resolution.config.MatchingPolicy;
import com.contact.resolution.core.model.Contact;
import com.contact.resolution.core.model.ContactField;
import com.contact.resolution.core.model.MatchConfidence;
import com.contact.resolution.core.model.NormalizedRecord;
import com.contact.resolution.rules.ContactNormalizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;

/**
 * Combines an incoming record with a resolved contact under a per-field precedence policy.
 *
 * <ul>
 *   <li>name, email, phone, company, title: existing non-empty value wins unless the
 *       incoming platform is authoritative for the field; email is never replaced by a
 *       different non-empty email and such a clash is reported as a {@link MergeConflictWarning}</li>
 *   <li>leadSources: union</li>
 *   <li>notes: append with a provenance prefix, skipping an entry already present</li>
 *   <li>createdAt: earliest; lastActivityDate: latest</li>
 *   <li>assignedOwner: existing unless empty</li>
 * </ul>
 * Every resulting value is one of the two inputs (or their union, min, max or concatenation).
 * Applying the same record twice changes nothing the second time.
 */
public class ContactMergeEngine {
    private static final Logger log = LoggerFactory.getLogger(ContactMergeEngine.class);

    static final String NOTE_SEPARATOR = "\n\n";

    private final MatchingPolicy policy;

    public ContactMergeEngine(MatchingPolicy policy) {
        this.policy = Objects.requireNonNull(policy, "policy is required");
    }

    /**
     * Merges the record into the contact.
     *
     * @throws IllegalArgumentException if the confidence does not permit a merge
     */
    public MergeResult merge(Contact existing, NormalizedRecord incoming, MatchConfidence confidence) {
        Objects.requireNonNull(existing, "existing is required");
        Objects.requireNonNull(incoming, "incoming is required");
        if (confidence == null || !confidence.allowsMerge()) {
            throw new IllegalArgumentException("Merge not permitted at confidence " + confidence);
        }

        Contact.Builder builder = Contact.builder(existing);
        Set<String> changed = new LinkedHashSet<>();
        List<MergeConflictWarning> warnings = new ArrayList<>();

        for (ContactField field : ContactField.values()) {
            String current = existing.get(field);
            String candidate = incomingValue(incoming, field);
            if (isEmpty(candidate)) {
                continue;
            }
            if (isEmpty(current)) {
                builder.set(field, candidate);
                changed.add(fieldName(field));
                continue;
            }
            if (sameValue(field, current, candidate)) {
                continue;
            }
            if (field == ContactField.EMAIL) {
                MergeConflictWarning warning =
                        new MergeConflictWarning(existing.getId(), field, current, candidate);
                log.warn("merge.conflict contactId={} field={} existing={} incoming={} source={}",
                        existing.getId(), fieldName(field), current, candidate, incoming.reference());
                warnings.add(warning);
                continue;
            }
            if (policy.isAuthoritative(incoming.sourcePlatform(), field)) {
                builder.set(field, candidate);
                changed.add(fieldName(field));
                log.debug("merge.override contactId={} field={} source={}",
                        existing.getId(), fieldName(field), incoming.sourcePlatform().tag());
            }
        }

        if (!existing.getLeadSources().contains(incoming.sourcePlatform())) {
            builder.leadSource(incoming.sourcePlatform());
            changed.add("leadSources");
        }

        String notes = appendNote(existing.getNotes(), incoming);
        if (!Objects.equals(notes, existing.getNotes())) {
            builder.notes(notes);
            changed.add("notes");
        }

        Instant createdAt = earliest(existing.getCreatedAt(), incoming.createdAt());
        if (!Objects.equals(createdAt, existing.getCreatedAt())) {
            builder.createdAt(createdAt);
            changed.add("createdAt");
        }

        Instant lastActivity = latest(existing.getLastActivityDate(), incoming.lastActivityDate());
        if (!Objects.equals(lastActivity, existing.getLastActivityDate())) {
            builder.lastActivityDate(lastActivity);
            changed.add("lastActivityDate");
        }

        if (isEmpty(existing.getAssignedOwner()) && !isEmpty(incoming.assignedOwner())) {
            builder.assignedOwner(incoming.assignedOwner());
            changed.add("assignedOwner");
        }

        Contact merged = changed.isEmpty() ? existing : builder.build();
        log.debug("merge.applied contactId={} confidence={} changed={} conflicts={}",
                existing.getId(), confidence, changed, warnings.size());
        return new MergeResult(merged, changed, warnings);
    }

    /**
     * Builds a new contact from a record that matched nobody.
     */
    public Contact create(NormalizedRecord record) {
        Objects.requireNonNull(record, "record is required");
        Instant createdAt = record.createdAt() != null ? record.createdAt() : record.observedAt();
        Contact contact = Contact.builder()
                .name(record.name())
                .email(record.email())
                .phone(record.phone())
                .company(record.company())
                .title(record.title())
                .leadSource(record.sourcePlatform())
                .notes(appendNote(null, record))
                .createdAt(createdAt)
                .lastActivityDate(record.lastActivityDate())
                .assignedOwner(record.assignedOwner())
                .build();
        log.debug("merge.created contactId={} source={}", contact.getId(), record.reference());
        return contact;
    }

    /**
     * Formats the provenance-prefixed note entry for a record, or null if it carries no notes.
     */
    static String noteEntry(NormalizedRecord record) {
        if (isEmpty(record.notes())) {
            return null;
        }
        Instant observed = record.observedAt();
        String prefix = observed != null
                ? "[" + record.sourcePlatform().tag() + " " + observed + "] "
                : "[" + record.sourcePlatform().tag() + "] ";
        return prefix + record.notes();
    }

    private static String appendNote(String existing, NormalizedRecord record) {
        String entry = noteEntry(record);
        if (entry == null) {
            return existing;
        }
        if (isEmpty(existing)) {
            return entry;
        }
        for (String present : existing.split(NOTE_SEPARATOR)) {
            if (present.equals(entry)) {
                return existing;
            }
        }
        return existing + NOTE_SEPARATOR + entry;
    }

    private static String incomingValue(NormalizedRecord record, ContactField field) {
        return switch (field) {
            case NAME -> record.name();
            case EMAIL -> record.email();
            case PHONE -> record.phone();
            case COMPANY -> record.company();
            case TITLE -> record.title();
        };
    }

    private static boolean sameValue(ContactField field, String current, String candidate) {
        return switch (field) {
            case EMAIL, NAME, COMPANY, TITLE -> current.trim().equalsIgnoreCase(candidate.trim());
            case PHONE -> Objects.equals(ContactNormalizer.phoneDigits(current), candidate);
        };
    }

    private static Instant earliest(Instant a, Instant b) {
        if (a == null) return b;
        if (b == null) return a;
        return a.isBefore(b) ? a : b;
    }

    private static Instant latest(Instant a, Instant b) {
        if (a == null) return b;
        if (b == null) return a;
        return a.isAfter(b) ? a : b;
    }

    private static boolean isEmpty(String value) {
        return value == null || value.isBlank();
    }

    private static String fieldName(ContactField field) {
        return field.name().toLowerCase(Locale.ROOT);
    }
}
