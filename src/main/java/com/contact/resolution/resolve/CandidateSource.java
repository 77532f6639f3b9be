package com.contact.resolution.resolve;

import com.contact.resolution.core.model.Contact;
import com.contact.resolution.core.model.NormalizedRecord;

import java.util.Collection;

/**
 * Read path used by the resolver. Implementations must find contacts by normalized email,
 * normalized phone and name tokens at minimum.
 */
@FunctionalInterface
public interface CandidateSource {

    /**
     * Returns the existing contacts that may describe the same person as the record.
     * Failures propagate; they are never reported as an empty pool.
     */
    Collection<Contact> findCandidates(NormalizedRecord record);
}
