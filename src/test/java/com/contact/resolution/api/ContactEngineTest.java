package com.contact.resolution.api;

import com.contact.resolution.attribution.AttributionCacheConfig;
import com.contact.resolution.attribution.AttributionChain;
import com.contact.resolution.attribution.AttributionModel;
import com.contact.resolution.attribution.ContactAttribution;
import com.contact.resolution.audit.AuditAction;
import com.contact.resolution.audit.AuditEntry;
import com.contact.resolution.bulk.BatchSummary;
import com.contact.resolution.core.ContactNotFoundException;
import com.contact.resolution.core.model.Contact;
import com.contact.resolution.core.model.MatchConfidence;
import com.contact.resolution.core.model.RawContactRecord;
import com.contact.resolution.core.model.SourcePlatform;
import com.contact.resolution.core.model.event.Deal;
import com.contact.resolution.core.model.event.Event;
import com.contact.resolution.core.model.event.Meeting;
import com.contact.resolution.enhance.MeetingStage;
import com.contact.resolution.enhance.SequencedMeeting;
import com.contact.resolution.review.ReviewItem;
import com.contact.resolution.review.ReviewReason;
import com.contact.resolution.review.ReviewStatus;
import com.contact.resolution.rules.ValidationException;
import com.contact.resolution.store.EventStore;
import com.contact.resolution.store.InMemoryEventStore;
import com.contact.resolution.store.LinkedEvent;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static com.contact.resolution.TestEvents.activity;
import static com.contact.resolution.TestEvents.canceledMeeting;
import static com.contact.resolution.TestEvents.day;
import static com.contact.resolution.TestEvents.deal;
import static com.contact.resolution.TestEvents.form;
import static com.contact.resolution.TestEvents.meeting;
import static com.contact.resolution.TestEvents.wonDeal;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.spy;

@DisplayName("ContactEngine Tests")
class ContactEngineTest {

    private static final Instant NOW = Instant.parse("2024-12-01T00:00:00Z");

    private ContactEngine engine;

    @BeforeEach
    void setUp() {
        engine = ContactEngine.builder()
                .cacheConfig(AttributionCacheConfig.defaults())
                .clock(Clock.fixed(NOW, ZoneOffset.UTC))
                .build();
    }

    private static RawContactRecord.Builder raw(SourcePlatform platform, String id) {
        return RawContactRecord.builder().sourcePlatform(platform).sourceRecordId(id);
    }

    @Nested
    @DisplayName("Ingestion")
    class Ingestion {

        @Test
        @DisplayName("Exact email merges a second platform into the existing contact")
        void exactEmailMerge() {
            IngestResult first = engine.ingest(raw(SourcePlatform.CLOSE, "lead_1").email("j@x.com").build());
            IngestResult second = engine.ingest(raw(SourcePlatform.CALENDLY, "inv_1")
                    .email("j@x.com").phone("555-0100").build());

            assertEquals(IngestOutcome.CREATED, first.outcome());
            assertEquals(IngestOutcome.MERGED, second.outcome());
            assertEquals(MatchConfidence.EXACT, second.match().confidence());
            Contact merged = engine.findContact(first.contact().getId()).orElseThrow();
            assertEquals("5550100", merged.getPhone());
            assertEquals(Set.of(SourcePlatform.CLOSE, SourcePlatform.CALENDLY), merged.getLeadSources());
            assertEquals(2, merged.getSourcesCount());
            assertTrue(second.changedFields().contains("phone"));
        }

        @Test
        @DisplayName("Nickname match adopts the missing company")
        void nicknameMerge() {
            IngestResult first = engine.ingest(raw(SourcePlatform.CLOSE, "lead_1").name("William Carter").build());
            IngestResult second = engine.ingest(raw(SourcePlatform.TYPEFORM, "resp_1")
                    .name("Bill Carter").company("Acme").build());

            assertEquals(MatchConfidence.MEDIUM, second.match().confidence());
            assertEquals(IngestOutcome.MERGED, second.outcome());
            Contact merged = engine.findContact(first.contact().getId()).orElseThrow();
            assertEquals("Acme", merged.getCompany());
            assertEquals("William Carter", merged.getName());
        }

        @Test
        @DisplayName("Nickname alone with the same company resolves to the full name")
        void nicknameFirstNameWithCompany() {
            IngestResult first = engine.ingest(raw(SourcePlatform.CLOSE, "lead_1")
                    .name("William Carter").company("Acme").build());
            IngestResult second = engine.ingest(raw(SourcePlatform.TYPEFORM, "resp_1")
                    .name("Bill").company("Acme").build());

            assertEquals(MatchConfidence.MEDIUM, second.match().confidence());
            assertEquals(IngestOutcome.MERGED, second.outcome());
            assertEquals(first.contact().getId(), second.contact().getId());
        }

        @Test
        @DisplayName("Different emails create a new contact and leave the original untouched")
        void differentEmailsCreate() {
            IngestResult first = engine.ingest(raw(SourcePlatform.CLOSE, "lead_1").email("a@x.com").build());
            IngestResult second = engine.ingest(raw(SourcePlatform.CLOSE, "lead_2").email("b@x.com").build());

            assertTrue(second.isNewContact());
            assertNotEquals(first.contact().getId(), second.contact().getId());
            assertEquals("a@x.com", engine.findContact(first.contact().getId()).orElseThrow().getEmail());
        }

        @Test
        @DisplayName("Consumer plus-address does not merge")
        void consumerPlusAddress() {
            engine.ingest(raw(SourcePlatform.CLOSE, "lead_1").name("Jane Doe").email("jane@gmail.com").build());
            IngestResult result = engine.ingest(raw(SourcePlatform.TYPEFORM, "resp_1")
                    .name("Jane Doe").email("jane+newsletter@gmail.com").build());

            assertNotEquals(IngestOutcome.MERGED, result.outcome());
            assertFalse(result.match().confidence().isAtLeast(MatchConfidence.MEDIUM));
        }

        @Test
        @DisplayName("Phone match with a different email files an email conflict")
        void emailConflict() {
            IngestResult first = engine.ingest(raw(SourcePlatform.CLOSE, "lead_1")
                    .name("John Smith").email("john@acme.com").phone("415-555-0100").build());
            IngestResult second = engine.ingest(raw(SourcePlatform.CALENDLY, "inv_1")
                    .name("John Smith").email("john@globex.com").phone("(415) 555-0100").build());

            assertEquals(IngestOutcome.MERGED, second.outcome());
            assertEquals(1, second.warnings().size());
            assertEquals(1, second.reviewItemIds().size());
            assertTrue(second.needsReview());
            assertEquals("john@acme.com", engine.findContact(first.contact().getId()).orElseThrow().getEmail());

            ReviewItem item = engine.getReviewQueue().get(second.reviewItemIds().get(0));
            assertEquals(ReviewReason.EMAIL_CONFLICT, item.getReason());
            List<AuditEntry> conflicts = engine.getAuditService().getEntriesByAction(AuditAction.MERGE_CONFLICT);
            assertEquals(1, conflicts.size());
            assertEquals(item.getId(), conflicts.get(0).reviewId());
            assertEquals(2, engine.getAuditService().getEntriesForReview(item.getId()).size());
        }

        @Test
        @DisplayName("Ambiguous match creates a contact pending review")
        void ambiguousMatch() {
            engine.ingest(raw(SourcePlatform.CLOSE, "lead_1").name("Jane Doe").email("jane@acme.com").build());
            engine.ingest(raw(SourcePlatform.CLOSE, "lead_2").name("Jane Doe").email("jane@globex.com").build());
            int before = engine.getPendingReviews().size();

            IngestResult result = engine.ingest(raw(SourcePlatform.TYPEFORM, "resp_1").name("Jane Doe").build());

            assertEquals(IngestOutcome.CREATED_PENDING_REVIEW, result.outcome());
            assertEquals(MatchConfidence.LOW, result.match().confidence());
            assertEquals(before + 1, engine.getPendingReviews().size());
            ReviewItem item = engine.getReviewQueue().get(result.reviewItemIds().get(0));
            assertEquals(ReviewReason.AMBIGUOUS_MATCH, item.getReason());
            assertEquals(result.contact().getId(), item.getContactId());
        }

        @Test
        @DisplayName("Invalid record is rejected with ValidationException")
        void invalidRecord() {
            RawContactRecord record = raw(SourcePlatform.CLOSE, "lead_1").company("Acme").build();

            assertThrows(ValidationException.class, () -> engine.ingest(record));
            assertTrue(engine.getAuditService().getAllEntries().isEmpty());
        }

        @Test
        @DisplayName("Preview resolves without writing")
        void previewDoesNotWrite() {
            engine.ingest(raw(SourcePlatform.CLOSE, "lead_1").email("j@x.com").build());
            int auditSize = engine.getAuditService().size();

            assertEquals(MatchConfidence.EXACT,
                    engine.preview(raw(SourcePlatform.CALENDLY, "inv_1").email("j@x.com").build()).confidence());
            assertEquals(auditSize, engine.getAuditService().size());
        }

        @Test
        @DisplayName("Creation and merge are audited")
        void audited() {
            IngestResult first = engine.ingest(raw(SourcePlatform.CLOSE, "lead_1").email("j@x.com")
                    .event(activity("act_1", 1)).build());
            engine.ingest(raw(SourcePlatform.CALENDLY, "inv_1").email("j@x.com").build());

            List<AuditEntry> entries = engine.getAuditService().getEntriesForContact(first.contact().getId());
            assertEquals(List.of(AuditAction.EVENT_LINKED, AuditAction.CONTACT_CREATED, AuditAction.CONTACT_MERGED),
                    entries.stream().map(AuditEntry::action).toList());
            assertEquals("close:lead_1", entries.get(0).actorId());

            AuditEntry created = entries.get(1);
            assertEquals(SourcePlatform.CLOSE, created.sourcePlatform());
            assertTrue(created.changedFields().contains("email"));
            AuditEntry merged = entries.get(2);
            assertEquals("calendly:inv_1", merged.sourceReference());
            assertEquals(SourcePlatform.CALENDLY, merged.sourcePlatform());
            assertTrue(merged.changedFields().contains("leadSources"));
            assertFalse(merged.changedFields().contains("email"));
        }
    }

    @Nested
    @DisplayName("Timeline and attribution")
    class Attribution {

        @Test
        @DisplayName("Events from several platforms build one last-touch chain")
        void lastTouchChain() {
            IngestResult typeform = engine.ingest(raw(SourcePlatform.TYPEFORM, "resp_1")
                    .email("j@x.com").event(form("f1", 1)).build());
            engine.ingest(raw(SourcePlatform.CALENDLY, "inv_1").email("j@x.com").event(meeting("m1", 2)).build());
            engine.ingest(raw(SourcePlatform.CLOSE, "lead_1").email("j@x.com")
                    .event(activity("a1", 3)).event(deal("d1", 7)).build());
            String contactId = typeform.contact().getId();

            List<AttributionChain> chains = engine.attribute(contactId);

            assertEquals(1, chains.size());
            AttributionChain chain = chains.get(0);
            assertEquals(3, chain.touchpointCount());
            assertEquals(AttributionModel.LAST_TOUCH, chain.model());
            assertEquals("m1", chain.lastMeeting().sourceId());
            assertEquals(Long.valueOf(5), chain.daysToConversion());
            assertEquals(NOW, chain.computedAt());
            assertEquals(0.98, chain.certainty(), 1e-9);

            ContactAttribution summary = engine.summarize(contactId);
            assertEquals(chains, summary.chains());
            assertTrue(summary.isHighCertainty());
        }

        @Test
        @DisplayName("Timeline is chronological across platforms")
        void timeline() {
            IngestResult first = engine.ingest(raw(SourcePlatform.CLOSE, "lead_1").email("j@x.com")
                    .event(activity("a1", 5)).build());
            engine.ingest(raw(SourcePlatform.TYPEFORM, "resp_1").email("j@x.com").event(form("f1", 1)).build());

            List<Event> timeline = engine.timeline(first.contact().getId());

            assertEquals(List.of(day(1), day(5)), timeline.stream().map(Event::timestamp).toList());
        }

        @Test
        @DisplayName("Won deal without cash gets its value as cash collected")
        void wonDealEnhanced() {
            IngestResult result = engine.ingest(raw(SourcePlatform.CLOSE, "lead_1").email("j@x.com")
                    .event(wonDeal("d1", 3, "5000")).build());

            AttributionChain chain = engine.attribute(result.contact().getId()).get(0);

            assertEquals(new BigDecimal("5000"), chain.deal().cashCollected());
        }

        @Test
        @DisplayName("Ingesting a new event invalidates cached chains")
        void cacheInvalidatedOnIngest() {
            IngestResult result = engine.ingest(raw(SourcePlatform.CLOSE, "lead_1").email("j@x.com")
                    .event(deal("d1", 5)).build());
            String contactId = result.contact().getId();
            assertEquals(0, engine.attribute(contactId).get(0).touchpointCount());

            engine.ingest(raw(SourcePlatform.CALENDLY, "inv_1").email("j@x.com").event(meeting("m1", 2)).build());

            assertEquals(1, engine.attribute(contactId).get(0).touchpointCount());
        }

        @Test
        @DisplayName("Meetings are sequenced into stages")
        void meetingSequence() {
            IngestResult result = engine.ingest(raw(SourcePlatform.CALENDLY, "inv_1").email("j@x.com")
                    .event(meeting("m1", 1)).event(canceledMeeting("m2", 2)).event(meeting("m3", 3)).build());

            List<SequencedMeeting> sequence = engine.meetingSequence(result.contact().getId());

            assertEquals(List.of(MeetingStage.INITIAL_CONSULTATION, MeetingStage.CANCELED,
                            MeetingStage.SOLUTION_PRESENTATION),
                    sequence.stream().map(SequencedMeeting::stage).toList());
        }

        @Test
        @DisplayName("Unknown contact raises ContactNotFoundException")
        void unknownContact() {
            assertThrows(ContactNotFoundException.class, () -> engine.attribute("missing"));
            assertThrows(ContactNotFoundException.class, () -> engine.timeline("missing"));
        }

        @Test
        @DisplayName("attributeAll covers every contact")
        void attributeAll() {
            engine.ingest(raw(SourcePlatform.CLOSE, "lead_1").email("a@x.com").event(deal("d1", 2)).build());
            engine.ingest(raw(SourcePlatform.CLOSE, "lead_2").email("b@x.com").build());

            var result = engine.attributeAll();

            assertEquals(2, result.summary().processed());
            assertEquals(1, result.totalChains());
        }
    }

    @Nested
    @DisplayName("Consistency")
    class Consistency {

        @Test
        @DisplayName("Moving an event drops the previous owner's cached chains")
        void relinkedEventInvalidatesPreviousOwner() {
            Deal shared = deal("d1", 5);
            IngestResult a = engine.ingest(raw(SourcePlatform.CLOSE, "lead_1").email("a@x.com").event(shared).build());
            assertEquals(1, engine.attribute(a.contact().getId()).size());

            IngestResult b = engine.ingest(raw(SourcePlatform.CLOSE, "lead_2").email("b@x.com").event(shared).build());

            assertTrue(engine.timeline(a.contact().getId()).isEmpty());
            assertTrue(engine.attribute(a.contact().getId()).isEmpty());
            assertEquals(1, engine.attribute(b.contact().getId()).size());
        }

        @Test
        @DisplayName("A failing event link rolls back the whole merge")
        void failedMergeRollsBack() {
            EventStore events = spy(new InMemoryEventStore());
            ContactEngine failing = ContactEngine.builder().eventStore(events).build();
            Meeting first = meeting("m1", 1);
            Meeting second = meeting("m2", 2);
            IngestResult owner = failing.ingest(raw(SourcePlatform.CALENDLY, "inv_1")
                    .email("other@x.com").event(first).build());
            IngestResult existing = failing.ingest(raw(SourcePlatform.CLOSE, "lead_1").email("j@x.com").build());
            Contact before = failing.findContact(existing.contact().getId()).orElseThrow();
            doThrow(new IllegalStateException("event store offline")).when(events).upsert(eq(second), anyString());

            RawContactRecord merge = raw(SourcePlatform.CALENDLY, "inv_2")
                    .email("j@x.com").phone("555-0100").title("CTO").event(first).event(second).build();
            assertThrows(IllegalStateException.class, () -> failing.ingest(merge));

            Contact after = failing.findContact(existing.contact().getId()).orElseThrow();
            assertTrue(before.sameStateAs(after));
            assertNull(after.getPhone());
            LinkedEvent restored = events.find(first.key()).orElseThrow();
            assertEquals(owner.contact().getId(), restored.contactId());
            assertTrue(events.find(second.key()).isEmpty());
            assertTrue(failing.timeline(existing.contact().getId()).isEmpty());
        }
    }

    @Nested
    @DisplayName("Review workflow")
    class Review {

        @Test
        @DisplayName("Approving and rejecting are audited")
        void reviewAudited() {
            engine.ingest(raw(SourcePlatform.CLOSE, "lead_1").name("John Smith")
                    .email("john@acme.com").phone("4155550100").build());
            engine.ingest(raw(SourcePlatform.CLOSE, "lead_2").name("John Smith")
                    .email("john@globex.com").phone("4155550100").build());
            engine.ingest(raw(SourcePlatform.CLOSE, "lead_3").name("John Smith")
                    .email("john@initech.com").phone("4155550100").build());
            List<ReviewItem> pending = engine.getPendingReviews();
            assertEquals(2, pending.size());

            ReviewItem approved = engine.approveReview(pending.get(0).getId(), "reviewer-1", "same person");
            ReviewItem rejected = engine.rejectReview(pending.get(1).getId(), "reviewer-1", null);

            assertEquals(ReviewStatus.APPROVED, approved.getStatus());
            assertEquals(ReviewStatus.REJECTED, rejected.getStatus());
            assertTrue(engine.getPendingReviews().isEmpty());
            List<AuditEntry> completed = engine.getAuditService()
                    .getEntriesByAction(AuditAction.MANUAL_REVIEW_COMPLETED);
            assertEquals(2, completed.size());
            assertEquals("reviewer-1", completed.get(0).actorId());
        }
    }

    @Nested
    @DisplayName("Concurrency")
    class Concurrency {

        @Test
        @DisplayName("Concurrent records with the same email create exactly one contact")
        void concurrentSameEmail() throws Exception {
            int threads = 8;
            ExecutorService executor = Executors.newFixedThreadPool(threads);
            CountDownLatch start = new CountDownLatch(1);
            List<Future<IngestResult>> futures = new ArrayList<>();
            SourcePlatform[] platforms = SourcePlatform.values();
            for (int i = 0; i < threads; i++) {
                RawContactRecord record = raw(platforms[i % platforms.length], "rec_" + i)
                        .email("race@x.com").name("Race Condition").build();
                futures.add(executor.submit(() -> {
                    start.await();
                    return engine.ingest(record);
                }));
            }
            start.countDown();

            List<IngestResult> results = new ArrayList<>();
            for (Future<IngestResult> future : futures) {
                results.add(future.get(10, TimeUnit.SECONDS));
            }
            executor.shutdown();

            assertEquals(1, results.stream().filter(IngestResult::isNewContact).count());
            assertEquals(1, results.stream().map(r -> r.contact().getId()).distinct().count());
            Contact contact = engine.findContact(results.get(0).contact().getId()).orElseThrow();
            assertEquals(Set.of(platforms), contact.getLeadSources());
        }

        @Test
        @DisplayName("Batch ingestion isolates failing records")
        void batchIngestion() {
            BatchSummary summary = engine.ingestBatch(List.of(
                    raw(SourcePlatform.CLOSE, "lead_1").email("a@x.com").build(),
                    raw(SourcePlatform.CALENDLY, "inv_1").email("a@x.com").build(),
                    raw(SourcePlatform.TYPEFORM, "resp_1").company("Nameless Inc").build()));

            assertEquals(3, summary.processed());
            assertEquals(2, summary.succeeded());
            assertEquals(1, summary.created());
            assertEquals(1, summary.merged());
            assertEquals(1, summary.failed());
            assertEquals("typeform:resp_1", summary.errors().get(0).itemId());
        }
    }
}
