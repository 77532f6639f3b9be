package com.contact.resolution.review;

import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

/**
 * One entry of the manual review queue.
 * For {@link ReviewReason#AMBIGUOUS_MATCH} the contact is the one created for the record and the
 * candidate is the most recently active of the ambiguous matches; for
 * {@link ReviewReason#EMAIL_CONFLICT} the contact is the merged one and there is no candidate.
 */
public class ReviewItem {

    private final String id;
    private final ReviewReason reason;
    private final String contactId;
    private final String candidateContactId;
    private final String sourceReference;
    private final String detail;
    private final double score;
    private final Instant submittedAt;
    private ReviewStatus status;
    private Instant reviewedAt;
    private String reviewerId;
    private String notes;

    private ReviewItem(Builder builder) {
        this.id = builder.id != null ? builder.id : UUID.randomUUID().toString();
        this.reason = Objects.requireNonNull(builder.reason, "reason is required");
        this.contactId = Objects.requireNonNull(builder.contactId, "contactId is required");
        this.candidateContactId = builder.candidateContactId;
        this.sourceReference = builder.sourceReference;
        this.detail = builder.detail;
        this.score = builder.score;
        this.status = builder.status != null ? builder.status : ReviewStatus.PENDING;
        this.submittedAt = builder.submittedAt != null ? builder.submittedAt : Instant.now();
    }

    public String getId() {
        return id;
    }

    public ReviewReason getReason() {
        return reason;
    }

    public String getContactId() {
        return contactId;
    }

    public String getCandidateContactId() {
        return candidateContactId;
    }

    public String getSourceReference() {
        return sourceReference;
    }

    public String getDetail() {
        return detail;
    }

    public double getScore() {
        return score;
    }

    public synchronized ReviewStatus getStatus() {
        return status;
    }

    public Instant getSubmittedAt() {
        return submittedAt;
    }

    public synchronized Instant getReviewedAt() {
        return reviewedAt;
    }

    public synchronized String getReviewerId() {
        return reviewerId;
    }

    public synchronized String getNotes() {
        return notes;
    }

    public synchronized boolean isPending() {
        return status == ReviewStatus.PENDING;
    }

    synchronized void complete(ReviewStatus outcome, String reviewerId, String notes) {
        if (status != ReviewStatus.PENDING) {
            throw new IllegalStateException("Review item is not pending: " + id);
        }
        this.status = outcome;
        this.reviewedAt = Instant.now();
        this.reviewerId = reviewerId;
        this.notes = notes;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ReviewItem that = (ReviewItem) o;
        return Objects.equals(id, that.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "ReviewItem{" +
                "id='" + id + '\'' +
                ", reason=" + reason +
                ", contactId='" + contactId + '\'' +
                ", candidateContactId='" + candidateContactId + '\'' +
                ", status=" + getStatus() +
                '}';
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String id;
        private ReviewReason reason;
        private String contactId;
        private String candidateContactId;
        private String sourceReference;
        private String detail;
        private double score;
        private ReviewStatus status;
        private Instant submittedAt;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder reason(ReviewReason reason) {
            this.reason = reason;
            return this;
        }

        public Builder contactId(String contactId) {
            this.contactId = contactId;
            return this;
        }

        public Builder candidateContactId(String candidateContactId) {
            this.candidateContactId = candidateContactId;
            return this;
        }

        public Builder sourceReference(String sourceReference) {
            this.sourceReference = sourceReference;
            return this;
        }

        public Builder detail(String detail) {
            this.detail = detail;
            return this;
        }

        public Builder score(double score) {
            this.score = score;
            return this;
        }

        public Builder status(ReviewStatus status) {
            this.status = status;
            return this;
        }

        public Builder submittedAt(Instant submittedAt) {
            this.submittedAt = submittedAt;
            return this;
        }

        public ReviewItem build() {
            return new ReviewItem(this);
        }
    }
}
