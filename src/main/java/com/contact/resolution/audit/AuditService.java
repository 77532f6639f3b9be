package com.contact.resolution.audit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Append-only log of contact creations, merges, conflicts, event links and reviews.
 * Thread-safe.
 */
public class AuditService {
    private static final Logger log = LoggerFactory.getLogger(AuditService.class);

    private final List<AuditEntry> entries = new CopyOnWriteArrayList<>();

    public AuditEntry record(AuditEntry entry) {
        entries.add(entry);
        log.debug("audit.recorded action={} contactId={} actor={} review={}",
                entry.action(), entry.contactId(), entry.actorId(), entry.reviewId());
        return entry;
    }

    public AuditEntry record(AuditAction action, String contactId, String actorId, Map<String, Object> details) {
        return record(AuditEntry.builder()
                .action(action)
                .contactId(contactId)
                .actorId(actorId)
                .details(details)
                .build());
    }

    public AuditEntry record(AuditAction action, String contactId, String actorId) {
        return record(action, contactId, actorId, null);
    }

    public List<AuditEntry> getAllEntries() {
        return Collections.unmodifiableList(new ArrayList<>(entries));
    }

    public List<AuditEntry> getEntriesForContact(String contactId) {
        return entries.stream()
                .filter(e -> contactId.equals(e.contactId()))
                .toList();
    }

    /**
     * Everything a single source record did: creation or merge, event links, conflicts.
     */
    public List<AuditEntry> getEntriesForSource(String sourceReference) {
        return entries.stream()
                .filter(e -> sourceReference.equals(e.sourceReference()))
                .toList();
    }

    /**
     * The request and completion entries of a review item.
     */
    public List<AuditEntry> getEntriesForReview(String reviewId) {
        return entries.stream()
                .filter(e -> reviewId.equals(e.reviewId()))
                .toList();
    }

    public List<AuditEntry> getEntriesByAction(AuditAction action) {
        return entries.stream()
                .filter(e -> e.action() == action)
                .toList();
    }

    /**
     * Entries recorded within the time range, inclusive.
     */
    public List<AuditEntry> getEntriesBetween(Instant start, Instant end) {
        return entries.stream()
                .filter(e -> !e.timestamp().isBefore(start) && !e.timestamp().isAfter(end))
                .toList();
    }

    public int size() {
        return entries.size();
    }
}
