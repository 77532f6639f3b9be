package com.contact.resolution.review;

import java.util.List;

/**
 * Manual review queue for ambiguous matches and merge conflicts.
 */
public interface ReviewQueue {

    /**
     * Submits a review item to the queue.
     */
    ReviewItem submit(ReviewItem item);

    /**
     * Pending items, oldest first.
     */
    List<ReviewItem> getPending();

    List<ReviewItem> getPendingByReason(ReviewReason reason);

    /**
     * Marks a pending item as approved.
     *
     * @throws IllegalArgumentException if the item does not exist
     * @throws IllegalStateException    if the item was already reviewed
     */
    ReviewItem approve(String reviewId, String reviewerId, String notes);

    /**
     * Marks a pending item as rejected.
     *
     * @throws IllegalArgumentException if the item does not exist
     * @throws IllegalStateException    if the item was already reviewed
     */
    ReviewItem reject(String reviewId, String reviewerId, String notes);

    /**
     * @return the review item, or null if not found
     */
    ReviewItem get(String reviewId);

    long countPending();
}
