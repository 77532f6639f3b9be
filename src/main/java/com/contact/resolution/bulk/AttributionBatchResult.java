package com.contact.resolution.bulk;

import com.contact.resolution.attribution.AttributionChain;
import com.contact.resolution.attribution.ContactAttribution;

import java.util.List;
import java.util.Map;

/**
 * Attributions computed for a batch of contacts, keyed by contact id, with aggregate
 * certainty over the contacts that succeeded.
 */
public record AttributionBatchResult(BatchSummary summary, Map<String, ContactAttribution> attributions) {
    public AttributionBatchResult {
        attributions = attributions != null ? Map.copyOf(attributions) : Map.of();
    }

    public List<AttributionChain> chainsFor(String contactId) {
        ContactAttribution attribution = attributions.get(contactId);
        return attribution != null ? attribution.chains() : List.of();
    }

    public int totalChains() {
        return attributions.values().stream().mapToInt(a -> a.chains().size()).sum();
    }

    public long contactsWithDeals() {
        return attributions.values().stream().filter(ContactAttribution::hasDeals).count();
    }

    /**
     * Mean certainty, 0.0 for an empty result.
     */
    public double averageCertainty() {
        return attributions.values().stream()
                .mapToDouble(ContactAttribution::certainty)
                .average()
                .orElse(0.0);
    }

    public long highCertaintyContacts() {
        return attributions.values().stream().filter(ContactAttribution::isHighCertainty).count();
    }

    public double highCertaintyRate() {
        return attributions.isEmpty() ? 0.0 : (double) highCertaintyContacts() / attributions.size();
    }
}
