package com.contact.resolution.bulk;

import com.contact.resolution.api.IngestOutcome;
import com.contact.resolution.api.IngestResult;
import com.contact.resolution.attribution.ContactAttribution;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Thread-safe tally of per-item outcomes, written by worker threads.
 */
class BatchAccumulator {

    private int processed;
    private int succeeded;
    private int created;
    private int merged;
    private int flagged;
    private final List<BatchError> errors = new ArrayList<>();
    private final Map<String, ContactAttribution> attributions = new LinkedHashMap<>();

    synchronized void recordIngest(IngestResult result) {
        processed++;
        succeeded++;
        if (result.outcome() == IngestOutcome.MERGED) {
            merged++;
        } else {
            created++;
        }
        if (result.needsReview()) {
            flagged++;
        }
    }

    synchronized void recordAttribution(ContactAttribution attribution) {
        processed++;
        succeeded++;
        attributions.put(attribution.contactId(), attribution);
    }

    synchronized void recordError(String itemId, Exception e) {
        processed++;
        errors.add(new BatchError(itemId, e.getClass().getSimpleName(), e.getMessage()));
    }

    synchronized BatchSummary summary() {
        return new BatchSummary(processed, succeeded, created, merged, flagged, errors);
    }

    synchronized Map<String, ContactAttribution> attributions() {
        return new LinkedHashMap<>(attributions);
    }
}
