package com.contact.resolution.api;

import com.contact.resolution.attribution.AttributionCache;
import com.contact.resolution.attribution.AttributionCacheConfig;
import com.contact.resolution.attribution.AttributionChain;
import com.contact.resolution.attribution.AttributionChainBuilder;
import com.contact.resolution.attribution.AttributionService;
import com.contact.resolution.attribution.CaffeineAttributionCache;
import com.contact.resolution.attribution.ContactAttribution;
import com.contact.resolution.attribution.NoOpAttributionCache;
import com.contact.resolution.audit.AuditAction;
import com.contact.resolution.audit.AuditEntry;
import com.contact.resolution.audit.AuditService;
import com.contact.resolution.bulk.AttributionBatchResult;
import com.contact.resolution.bulk.BatchOptions;
import com.contact.resolution.bulk.BatchSummary;
import com.contact.resolution.bulk.ContactBatchProcessor;
import com.contact.resolution.config.MatchingPolicy;
import com.contact.resolution.core.model.Contact;
import com.contact.resolution.core.model.MatchResult;
import com.contact.resolution.core.model.RawContactRecord;
import com.contact.resolution.core.model.event.Event;
import com.contact.resolution.enhance.DealEnhancer;
import com.contact.resolution.enhance.MeetingSequencer;
import com.contact.resolution.enhance.SequencedMeeting;
import com.contact.resolution.lock.ContactLock;
import com.contact.resolution.lock.LocalContactLock;
import com.contact.resolution.merge.ContactChangeListener;
import com.contact.resolution.merge.ContactMergeEngine;
import com.contact.resolution.metrics.MetricsService;
import com.contact.resolution.metrics.NoOpMetricsService;
import com.contact.resolution.resolve.IdentityResolver;
import com.contact.resolution.review.InMemoryReviewQueue;
import com.contact.resolution.review.ReviewItem;
import com.contact.resolution.review.ReviewQueue;
import com.contact.resolution.rules.ContactNormalizer;
import com.contact.resolution.store.ContactStore;
import com.contact.resolution.store.EventStore;
import com.contact.resolution.store.InMemoryContactStore;
import com.contact.resolution.store.InMemoryEventStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Main entry point of the library: ingest contact records from any source platform,
 * then read back unified contacts, timelines and attribution chains.
 *
 * <pre>
 * ContactEngine engine = ContactEngine.builder()
 *     .cacheConfig(AttributionCacheConfig.defaults())
 *     .build();
 *
 * IngestResult result = engine.ingest(record);
 * List&lt;AttributionChain&gt; chains = engine.attribute(result.contact().getId());
 *
 * BatchSummary summary = engine.ingestBatch(records);
 * </pre>
 *
 * Every collaborator defaults to an in-memory implementation.
 */
public class ContactEngine {
    private static final Logger log = LoggerFactory.getLogger(ContactEngine.class);

    private final ContactIngestionService ingestionService;
    private final AttributionService attributionService;
    private final ContactBatchProcessor batchProcessor;
    private final MeetingSequencer meetingSequencer;
    private final ContactStore contactStore;
    private final ReviewQueue reviewQueue;
    private final AuditService auditService;

    private ContactEngine(Builder builder) {
        MatchingPolicy policy = builder.policy != null ? builder.policy : MatchingPolicy.defaults();
        this.contactStore = builder.contactStore != null
                ? builder.contactStore : new InMemoryContactStore(policy.getNicknames());
        EventStore eventStore = builder.eventStore != null ? builder.eventStore : new InMemoryEventStore();
        ContactLock lock = builder.lock != null ? builder.lock : new LocalContactLock();
        MetricsService metricsService = builder.metricsService != null
                ? builder.metricsService : new NoOpMetricsService();
        this.reviewQueue = builder.reviewQueue != null ? builder.reviewQueue : new InMemoryReviewQueue();
        this.auditService = builder.auditService != null ? builder.auditService : new AuditService();
        Clock clock = builder.clock != null ? builder.clock : Clock.systemUTC();

        AttributionCache cache;
        if (builder.attributionCache != null) {
            cache = builder.attributionCache;
        } else if (builder.cacheConfig != null && builder.cacheConfig.enabled()) {
            cache = new CaffeineAttributionCache(builder.cacheConfig);
        } else {
            cache = new NoOpAttributionCache();
        }

        this.ingestionService = new ContactIngestionService(
                new ContactNormalizer(policy),
                new IdentityResolver(policy),
                new ContactMergeEngine(policy),
                contactStore, eventStore, lock, auditService, reviewQueue, metricsService);

        // Committed writes drop cached chains
        if (cache instanceof ContactChangeListener listener) {
            ingestionService.addChangeListener(listener);
        }

        this.attributionService = new AttributionService(contactStore, eventStore,
                new AttributionChainBuilder(clock), new DealEnhancer(), cache, metricsService);
        this.batchProcessor = new ContactBatchProcessor(ingestionService, attributionService,
                metricsService, builder.batchOptions);
        this.meetingSequencer = new MeetingSequencer();

        log.info("engine.initialized cache={} lock={}", cache.getClass().getSimpleName(),
                lock.getClass().getSimpleName());
    }

    // ========== Ingestion ==========

    public IngestResult ingest(RawContactRecord record) {
        return ingestionService.ingest(record);
    }

    /**
     * Resolves a record against the current contacts without writing anything.
     */
    public MatchResult preview(RawContactRecord record) {
        return ingestionService.preview(record);
    }

    public BatchSummary ingestBatch(List<RawContactRecord> records) {
        return batchProcessor.ingestAll(records);
    }

    public BatchSummary ingestBatch(List<RawContactRecord> records, BatchOptions options) {
        return batchProcessor.ingestAll(records, options);
    }

    // ========== Read side ==========

    public Optional<Contact> findContact(String contactId) {
        return contactStore.findById(contactId);
    }

    /**
     * Chronological events of a contact across all platforms.
     */
    public List<Event> timeline(String contactId) {
        return attributionService.timeline(contactId);
    }

    public List<SequencedMeeting> meetingSequence(String contactId) {
        return meetingSequencer.sequenceEvents(attributionService.timeline(contactId));
    }

    public List<AttributionChain> attribute(String contactId) {
        return attributionService.attribute(contactId);
    }

    /**
     * Chains of a contact together with its overall attribution certainty.
     */
    public ContactAttribution summarize(String contactId) {
        return attributionService.summarize(contactId);
    }

    public AttributionBatchResult attributeAll() {
        return batchProcessor.attributeAll(contactStore.findAllIds());
    }

    public AttributionBatchResult attributeAll(List<String> contactIds) {
        return batchProcessor.attributeAll(contactIds);
    }

    // ========== Review ==========

    public List<ReviewItem> getPendingReviews() {
        return reviewQueue.getPending();
    }

    public ReviewItem approveReview(String reviewId, String reviewerId, String notes) {
        ReviewItem item = reviewQueue.approve(reviewId, reviewerId, notes);
        auditReview(item, reviewerId);
        return item;
    }

    public ReviewItem rejectReview(String reviewId, String reviewerId, String notes) {
        ReviewItem item = reviewQueue.reject(reviewId, reviewerId, notes);
        auditReview(item, reviewerId);
        return item;
    }

    private void auditReview(ReviewItem item, String reviewerId) {
        auditService.record(AuditEntry.builder()
                .action(AuditAction.MANUAL_REVIEW_COMPLETED)
                .contactId(item.getContactId())
                .actorId(reviewerId)
                .reviewId(item.getId())
                .details(Map.of("status", item.getStatus().name()))
                .build());
        log.info("review.completed reviewId={} status={} reviewer={}", item.getId(), item.getStatus(), reviewerId);
    }

    public ReviewQueue getReviewQueue() {
        return reviewQueue;
    }

    public AuditService getAuditService() {
        return auditService;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private MatchingPolicy policy;
        private ContactStore contactStore;
        private EventStore eventStore;
        private ContactLock lock;
        private MetricsService metricsService;
        private AttributionCache attributionCache;
        private AttributionCacheConfig cacheConfig;
        private ReviewQueue reviewQueue;
        private AuditService auditService;
        private BatchOptions batchOptions;
        private Clock clock;

        public Builder policy(MatchingPolicy policy) {
            this.policy = policy;
            return this;
        }

        public Builder contactStore(ContactStore contactStore) {
            this.contactStore = contactStore;
            return this;
        }

        public Builder eventStore(EventStore eventStore) {
            this.eventStore = eventStore;
            return this;
        }

        public Builder lock(ContactLock lock) {
            this.lock = lock;
            return this;
        }

        public Builder metricsService(MetricsService metricsService) {
            this.metricsService = metricsService;
            return this;
        }

        /**
         * Uses the given cache. Takes precedence over {@link #cacheConfig(AttributionCacheConfig)}.
         */
        public Builder attributionCache(AttributionCache cache) {
            this.attributionCache = cache;
            return this;
        }

        /**
         * Builds a Caffeine cache from the config when it is enabled.
         */
        public Builder cacheConfig(AttributionCacheConfig config) {
            this.cacheConfig = config;
            return this;
        }

        public Builder reviewQueue(ReviewQueue reviewQueue) {
            this.reviewQueue = reviewQueue;
            return this;
        }

        public Builder auditService(AuditService auditService) {
            this.auditService = auditService;
            return this;
        }

        public Builder batchOptions(BatchOptions batchOptions) {
            this.batchOptions = batchOptions;
            return this;
        }

        /**
         * Clock stamping computed chains.
         */
        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public ContactEngine build() {
            return new ContactEngine(this);
        }
    }
}
