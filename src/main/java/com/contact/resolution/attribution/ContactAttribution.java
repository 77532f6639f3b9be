package com.contact.resolution.attribution;

import java.util.List;
import java.util.Objects;

/**
 * A contact's attribution: its scored chains and the overall certainty.
 *
 * @param certainty the best chain certainty, or the score of the contact's touchpoints when it has no deals
 */
public record ContactAttribution(String contactId, List<AttributionChain> chains, double certainty) {
    public ContactAttribution {
        Objects.requireNonNull(contactId, "contactId is required");
        chains = chains != null ? List.copyOf(chains) : List.of();
        if (certainty < 0.0 || certainty > 1.0) {
            throw new IllegalArgumentException("certainty must be between 0.0 and 1.0");
        }
    }

    public boolean hasDeals() {
        return !chains.isEmpty();
    }

    public boolean isHighCertainty() {
        return certainty >= AttributionCertainty.HIGH_CERTAINTY;
    }
}
