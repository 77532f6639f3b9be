package com.contact.resolution.review;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Comparator;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * In-memory implementation of {@link ReviewQueue}.
 * Suitable for testing and single-JVM deployments.
 */
public class InMemoryReviewQueue implements ReviewQueue {
    private static final Logger log = LoggerFactory.getLogger(InMemoryReviewQueue.class);

    private final ConcurrentMap<String, ReviewItem> items = new ConcurrentHashMap<>();

    @Override
    public ReviewItem submit(ReviewItem item) {
        items.put(item.getId(), item);
        log.debug("review.submitted id={} reason={} contactId={} candidateId={}",
                item.getId(), item.getReason(), item.getContactId(), item.getCandidateContactId());
        return item;
    }

    @Override
    public List<ReviewItem> getPending() {
        return items.values().stream()
                .filter(ReviewItem::isPending)
                .sorted(Comparator.comparing(ReviewItem::getSubmittedAt))
                .toList();
    }

    @Override
    public List<ReviewItem> getPendingByReason(ReviewReason reason) {
        return items.values().stream()
                .filter(ReviewItem::isPending)
                .filter(item -> item.getReason() == reason)
                .sorted(Comparator.comparing(ReviewItem::getSubmittedAt))
                .toList();
    }

    @Override
    public ReviewItem approve(String reviewId, String reviewerId, String notes) {
        ReviewItem item = require(reviewId);
        item.complete(ReviewStatus.APPROVED, reviewerId, notes);
        log.info("review.approved id={} reviewer={}", reviewId, reviewerId);
        return item;
    }

    @Override
    public ReviewItem reject(String reviewId, String reviewerId, String notes) {
        ReviewItem item = require(reviewId);
        item.complete(ReviewStatus.REJECTED, reviewerId, notes);
        log.info("review.rejected id={} reviewer={}", reviewId, reviewerId);
        return item;
    }

    @Override
    public ReviewItem get(String reviewId) {
        return items.get(reviewId);
    }

    @Override
    public long countPending() {
        return items.values().stream().filter(ReviewItem::isPending).count();
    }

    private ReviewItem require(String reviewId) {
        ReviewItem item = items.get(reviewId);
        if (item == null) {
            throw new IllegalArgumentException("Review item not found: " + reviewId);
        }
        return item;
    }
}
