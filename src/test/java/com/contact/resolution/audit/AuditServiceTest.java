package com.contact.resolution.audit;

import com.contact.resolution.core.model.SourcePlatform;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class AuditServiceTest {

    private AuditService auditService;

    @BeforeEach
    void setUp() {
        auditService = new AuditService();
    }

    @Test
    @DisplayName("Should record entries with details")
    void testRecord() {
        AuditEntry entry = auditService.record(AuditAction.CONTACT_MERGED, "c1", "close:lead-1",
                Map.of("confidence", "EXACT"));

        assertNotNull(entry.id());
        assertEquals("EXACT", entry.details().get("confidence"));
        assertEquals(1, auditService.size());
    }

    @Test
    @DisplayName("Should filter by contact and action")
    void testFilters() {
        auditService.record(AuditAction.CONTACT_CREATED, "c1", "close:1");
        auditService.record(AuditAction.EVENT_LINKED, "c1", "close:1");
        auditService.record(AuditAction.CONTACT_CREATED, "c2", "typeform:2");

        assertEquals(2, auditService.getEntriesForContact("c1").size());
        assertEquals(2, auditService.getEntriesByAction(AuditAction.CONTACT_CREATED).size());
        assertTrue(auditService.getEntriesByAction(AuditAction.MERGE_CONFLICT).isEmpty());
    }

    @Test
    @DisplayName("Should filter by time range inclusively")
    void testBetween() {
        Instant t1 = Instant.parse("2024-01-01T00:00:00Z");
        Instant t2 = Instant.parse("2024-02-01T00:00:00Z");
        auditService.record(AuditEntry.builder().action(AuditAction.CONTACT_CREATED).contactId("c1").timestamp(t1).build());
        auditService.record(AuditEntry.builder().action(AuditAction.CONTACT_MERGED).contactId("c1").timestamp(t2).build());

        List<AuditEntry> inRange = auditService.getEntriesBetween(t1, t1);

        assertEquals(1, inRange.size());
        assertEquals(AuditAction.CONTACT_CREATED, inRange.get(0).action());
    }

    @Test
    @DisplayName("Source sets the actor and is queryable by reference")
    void testSource() {
        auditService.record(AuditEntry.builder()
                .action(AuditAction.CONTACT_MERGED)
                .contactId("c1")
                .source(SourcePlatform.CALENDLY, "calendly:inv_1")
                .changedFields(List.of("phone", "title"))
                .build());
        auditService.record(AuditAction.CONTACT_CREATED, "c2", "close:1");

        List<AuditEntry> fromInvite = auditService.getEntriesForSource("calendly:inv_1");

        assertEquals(1, fromInvite.size());
        AuditEntry entry = fromInvite.get(0);
        assertEquals("calendly:inv_1", entry.actorId());
        assertEquals(SourcePlatform.CALENDLY, entry.sourcePlatform());
        assertEquals(List.of("phone", "title"), List.copyOf(entry.changedFields()));
        assertFalse(entry.hasReview());
    }

    @Test
    @DisplayName("Review entries are linked by review id")
    void testReview() {
        auditService.record(AuditEntry.builder().action(AuditAction.MANUAL_REVIEW_REQUESTED)
                .contactId("c1").reviewId("r1").source(SourcePlatform.CLOSE, "close:1").build());
        auditService.record(AuditEntry.builder().action(AuditAction.MANUAL_REVIEW_COMPLETED)
                .contactId("c1").reviewId("r1").actorId("reviewer-1").build());
        auditService.record(AuditEntry.builder().action(AuditAction.MANUAL_REVIEW_REQUESTED)
                .contactId("c2").reviewId("r2").build());

        List<AuditEntry> review = auditService.getEntriesForReview("r1");

        assertEquals(List.of(AuditAction.MANUAL_REVIEW_REQUESTED, AuditAction.MANUAL_REVIEW_COMPLETED),
                review.stream().map(AuditEntry::action).toList());
        assertNull(review.get(1).sourcePlatform());
        assertTrue(review.get(1).changedFields().isEmpty());
    }

    @Test
    @DisplayName("Returned entries are a snapshot")
    void testSnapshot() {
        auditService.record(AuditAction.CONTACT_CREATED, "c1", "close:1");
        List<AuditEntry> all = auditService.getAllEntries();

        assertThrows(UnsupportedOperationException.class, () -> all.add(all.get(0)));
    }
}
