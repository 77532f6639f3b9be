package com.contact.resolution.bulk;

import java.util.List;

/**
 * Outcome counts of a batch run. Failed items are listed in {@link #errors()}; they never
 * abort the rest of the batch.
 */
public record BatchSummary(
        int processed,
        int succeeded,
        int created,
        int merged,
        int flaggedForReview,
        List<BatchError> errors
) {
    public BatchSummary {
        errors = errors != null ? List.copyOf(errors) : List.of();
    }

    public int failed() {
        return errors.size();
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }

    public double successRate() {
        return processed == 0 ? 1.0 : (double) succeeded / processed;
    }
}
