package com.contact.resolution.attribution;

import java.util.List;
import java.util.Optional;

/**
 * Cache of computed attribution chains, keyed by contact id.
 */
public interface AttributionCache {

    Optional<List<AttributionChain>> get(String contactId);

    /**
     * Current generation of a contact's entry. Every invalidation of the contact moves it on.
     */
    long generation(String contactId);

    /**
     * Stores chains computed from the contact's state at {@code generation}.
     *
     * @return false, storing nothing, if the contact was invalidated since that generation was read
     */
    boolean put(String contactId, long generation, List<AttributionChain> chains);

    /**
     * Drops the chains of a contact whose events or fields changed.
     */
    void invalidate(String contactId);

    void invalidateAll();

    CacheStats getStats();
}
