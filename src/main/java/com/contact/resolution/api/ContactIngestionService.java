package com.contact.resolution.api;

import com.contact.resolution.audit.AuditAction;
import com.contact.resolution.audit.AuditEntry;
import com.contact.resolution.audit.AuditService;
import com.contact.resolution.core.model.Contact;
import com.contact.resolution.core.model.MatchResult;
import com.contact.resolution.core.model.NormalizedRecord;
import com.contact.resolution.core.model.RawContactRecord;
import com.contact.resolution.core.model.event.Event;
import com.contact.resolution.lock.ContactLock;
import com.contact.resolution.logging.LogContext;
import com.contact.resolution.merge.ContactChangeListener;
import com.contact.resolution.merge.ContactMergeEngine;
import com.contact.resolution.merge.MergeConflictWarning;
import com.contact.resolution.merge.MergeResult;
import com.contact.resolution.merge.MergeTransaction;
import com.contact.resolution.metrics.MetricsService;
import com.contact.resolution.resolve.IdentityResolver;
import com.contact.resolution.review.ReviewItem;
import com.contact.resolution.review.ReviewQueue;
import com.contact.resolution.review.ReviewReason;
import com.contact.resolution.rules.ContactNormalizer;
import com.contact.resolution.rules.ValidationException;
import com.contact.resolution.store.ContactStore;
import com.contact.resolution.store.EventStore;
import com.contact.resolution.store.LinkedEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Orchestrates one record: normalize, resolve, then merge or create, persisting the
 * contact and its events atomically.
 *
 * <p>Resolution and creation run under the record's identity-key lock so two records of the
 * same person cannot both create a contact. A merge additionally holds the resolved contact's
 * lock and re-reads the contact under it, so concurrent merges into one contact serialize.
 * All writes of one record run in a {@link MergeTransaction}.</p>
 */
public class ContactIngestionService {
    private static final Logger log = LoggerFactory.getLogger(ContactIngestionService.class);

    private final ContactNormalizer normalizer;
    private final IdentityResolver resolver;
    private final ContactMergeEngine mergeEngine;
    private final ContactStore contactStore;
    private final EventStore eventStore;
    private final ContactLock lock;
    private final AuditService auditService;
    private final ReviewQueue reviewQueue;
    private final MetricsService metricsService;
    private final List<ContactChangeListener> listeners = new CopyOnWriteArrayList<>();

    public ContactIngestionService(ContactNormalizer normalizer,
                                   IdentityResolver resolver,
                                   ContactMergeEngine mergeEngine,
                                   ContactStore contactStore,
                                   EventStore eventStore,
                                   ContactLock lock,
                                   AuditService auditService,
                                   ReviewQueue reviewQueue,
                                   MetricsService metricsService) {
        this.normalizer = normalizer;
        this.resolver = resolver;
        this.mergeEngine = mergeEngine;
        this.contactStore = contactStore;
        this.eventStore = eventStore;
        this.lock = lock;
        this.auditService = auditService;
        this.reviewQueue = reviewQueue;
        this.metricsService = metricsService;
    }

    public void addChangeListener(ContactChangeListener listener) {
        listeners.add(listener);
    }

    /**
     * Ingests a raw record.
     *
     * @throws ValidationException if the record cannot be normalized
     * @throws com.contact.resolution.resolve.LookupException if the candidate pool cannot be read
     * @throws com.contact.resolution.lock.LockAcquisitionException if a lock times out
     */
    public IngestResult ingest(RawContactRecord raw) {
        try (LogContext ctx = LogContext.forIngest(LogContext.generateCorrelationId(),
                raw != null ? raw.reference() : null)) {
            NormalizedRecord record;
            try {
                record = normalizer.normalize(raw);
            } catch (ValidationException e) {
                metricsService.incrementIngestFailed();
                log.warn("ingest.rejected field={} error={}", e.getField(), e.getMessage());
                throw e;
            }
            return lock.withLock(record.identityKey(), () -> ingestLocked(record));
        }
    }

    /**
     * Resolves a record without writing anything.
     */
    public MatchResult preview(RawContactRecord raw) {
        NormalizedRecord record = normalizer.normalize(raw);
        return resolver.resolve(record, contactStore);
    }

    private IngestResult ingestLocked(NormalizedRecord record) {
        long start = System.nanoTime();
        MatchResult match = resolver.resolve(record, contactStore);
        metricsService.recordResolutionDuration(match.confidence(), Duration.ofNanos(System.nanoTime() - start));
        if (match.score() < 1.0 && match.hasMatch()) {
            metricsService.recordSimilarityScore(match.score());
        }

        if (match.allowsMerge()) {
            return lock.withLock(ContactLock.contactKey(match.contact().getId()), () -> mergeLocked(record, match));
        }
        return create(record, match);
    }

    private IngestResult mergeLocked(NormalizedRecord record, MatchResult match) {
        String contactId = match.contact().getId();
        Optional<Contact> current = contactStore.findById(contactId);
        if (current.isEmpty()) {
            log.warn("ingest.match.vanished contactId={}", contactId);
            return create(record, MatchResult.noMatch("matched contact " + contactId + " no longer exists"));
        }
        Contact existing = current.get();
        MergeResult merged = mergeEngine.merge(existing, record, match.confidence());
        Contact contact = merged.contact();
        List<String> reviewIds = new ArrayList<>();
        Set<String> previousOwners;

        try (MergeTransaction tx = new MergeTransaction(ContactLock.contactKey(contactId))) {
            if (merged.isChanged()) {
                tx.execute("persist merged contact",
                        () -> contactStore.persist(contact),
                        () -> contactStore.persist(existing));
            }
            previousOwners = linkEvents(tx, record, contactId);
            tx.executeNoCompensation("audit merge", () -> auditService.record(
                    audit(AuditAction.CONTACT_MERGED, contactId, record)
                            .changedFields(merged.changedFields())
                            .details(matchDetails(match))
                            .build()));
            for (MergeConflictWarning warning : merged.warnings()) {
                tx.executeNoCompensation("file conflict", () -> reviewIds.add(fileConflict(record, warning)));
            }
            tx.markSuccess();
        }

        notifyListeners(contactId, previousOwners);
        metricsService.incrementContactMerged(record.sourcePlatform());
        log.info("contact.merged contactId={} confidence={} changed={} conflicts={}",
                contactId, match.confidence(), merged.changedFields(), merged.warnings().size());
        return new IngestResult(IngestOutcome.MERGED, contact, match, merged.changedFields(),
                merged.warnings(), reviewIds);
    }

    private IngestResult create(NormalizedRecord record, MatchResult match) {
        Contact contact = mergeEngine.create(record);
        String contactId = contact.getId();
        List<String> reviewIds = new ArrayList<>();
        Set<String> previousOwners;

        try (MergeTransaction tx = new MergeTransaction(ContactLock.contactKey(contactId))) {
            tx.execute("persist new contact",
                    () -> contactStore.persist(contact),
                    () -> contactStore.remove(contactId));
            previousOwners = linkEvents(tx, record, contactId);
            tx.executeNoCompensation("audit creation", () -> auditService.record(
                    audit(AuditAction.CONTACT_CREATED, contactId, record)
                            .changedFields(createdFields(contact))
                            .details(matchDetails(match))
                            .build()));
            if (match.requiresReview()) {
                tx.executeNoCompensation("file ambiguous match",
                        () -> reviewIds.add(fileAmbiguous(record, contact, match)));
            }
            tx.markSuccess();
        }

        notifyListeners(contactId, previousOwners);
        metricsService.incrementContactCreated(record.sourcePlatform());
        IngestOutcome outcome = match.requiresReview() ? IngestOutcome.CREATED_PENDING_REVIEW : IngestOutcome.CREATED;
        log.info("contact.created contactId={} outcome={} reason=\"{}\"", contactId, outcome, match.reason());
        return new IngestResult(outcome, contact, match, createdFields(contact), List.of(), reviewIds);
    }

    /**
     * Links the record's events to the contact.
     *
     * @return ids of other contacts that owned one of the events before
     */
    private Set<String> linkEvents(MergeTransaction tx, NormalizedRecord record, String contactId) {
        Set<String> previousOwners = new LinkedHashSet<>();
        for (Event event : record.events()) {
            AtomicReference<Optional<LinkedEvent>> previous = new AtomicReference<>(Optional.empty());
            tx.execute("link event " + event.key(),
                    () -> previous.set(eventStore.upsert(event, contactId)),
                    () -> previous.get().ifPresentOrElse(
                            p -> eventStore.upsert(p.event(), p.contactId()),
                            () -> eventStore.remove(event.key())));
            previous.get()
                    .map(LinkedEvent::contactId)
                    .filter(owner -> !owner.equals(contactId))
                    .ifPresent(owner -> {
                        previousOwners.add(owner);
                        log.info("event.relinked event={} from={} to={}", event.key(), owner, contactId);
                    });
            tx.executeNoCompensation("audit event link", () -> auditService.record(
                    audit(AuditAction.EVENT_LINKED, contactId, record)
                            .details(Map.of("event", event.key().toString(), "type", event.type().name()))
                            .build()));
        }
        return previousOwners;
    }

    private String fileAmbiguous(NormalizedRecord record, Contact created, MatchResult match) {
        ReviewItem item = reviewQueue.submit(ReviewItem.builder()
                .reason(ReviewReason.AMBIGUOUS_MATCH)
                .contactId(created.getId())
                .candidateContactId(match.contact().getId())
                .sourceReference(record.reference())
                .detail(match.reason())
                .score(match.score())
                .build());
        auditService.record(audit(AuditAction.MANUAL_REVIEW_REQUESTED, created.getId(), record)
                .reviewId(item.getId())
                .details(Map.of("reason", ReviewReason.AMBIGUOUS_MATCH.name(),
                        "candidateId", match.contact().getId()))
                .build());
        metricsService.incrementAmbiguousMatch();
        log.info("review.requested reviewId={} reason={} contactId={} candidateId={}",
                item.getId(), ReviewReason.AMBIGUOUS_MATCH, created.getId(), match.contact().getId());
        return item.getId();
    }

    private String fileConflict(NormalizedRecord record, MergeConflictWarning warning) {
        ReviewItem item = reviewQueue.submit(ReviewItem.builder()
                .reason(ReviewReason.EMAIL_CONFLICT)
                .contactId(warning.contactId())
                .sourceReference(record.reference())
                .detail(warning.message())
                .score(1.0)
                .build());
        auditService.record(audit(AuditAction.MERGE_CONFLICT, warning.contactId(), record)
                .reviewId(item.getId())
                .details(Map.of("field", warning.field().name(),
                        "existing", warning.existingValue(),
                        "incoming", warning.incomingValue()))
                .build());
        auditService.record(audit(AuditAction.MANUAL_REVIEW_REQUESTED, warning.contactId(), record)
                .reviewId(item.getId())
                .details(Map.of("reason", ReviewReason.EMAIL_CONFLICT.name()))
                .build());
        metricsService.incrementMergeConflict();
        return item.getId();
    }

    private void notifyListeners(String contactId, Set<String> previousOwners) {
        notifyListeners(contactId);
        for (String owner : previousOwners) {
            notifyListeners(owner);
        }
    }

    private void notifyListeners(String contactId) {
        for (ContactChangeListener listener : listeners) {
            try {
                listener.onContactChanged(contactId);
            } catch (RuntimeException e) {
                log.warn("listener.failed contactId={} error={}", contactId, e.getMessage());
            }
        }
    }

    private static AuditEntry.Builder audit(AuditAction action, String contactId, NormalizedRecord record) {
        return AuditEntry.builder()
                .action(action)
                .contactId(contactId)
                .source(record.sourcePlatform(), record.reference());
    }

    private static Map<String, Object> matchDetails(MatchResult match) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("confidence", match.confidence().name());
        details.put("reason", match.reason() != null ? match.reason() : "");
        return details;
    }

    private static Set<String> createdFields(Contact contact) {
        Set<String> fields = new LinkedHashSet<>();
        if (contact.hasName()) fields.add("name");
        if (contact.hasEmail()) fields.add("email");
        if (contact.getPhone() != null) fields.add("phone");
        if (contact.getCompany() != null) fields.add("company");
        if (contact.getTitle() != null) fields.add("title");
        fields.add("leadSources");
        if (contact.getNotes() != null) fields.add("notes");
        return fields;
    }
}
