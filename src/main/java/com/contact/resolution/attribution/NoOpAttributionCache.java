package com.contact.resolution.attribution;

import java.util.List;
import java.util.Optional;

/**
 * Used when caching is disabled. Every lookup misses.
 */
public class NoOpAttributionCache implements AttributionCache {

    @Override
    public Optional<List<AttributionChain>> get(String contactId) {
        return Optional.empty();
    }

    @Override
    public long generation(String contactId) {
        return 0L;
    }

    @Override
    public boolean put(String contactId, long generation, List<AttributionChain> chains) {
        return false;
    }

    @Override
    public void invalidate(String contactId) {
        // no-op
    }

    @Override
    public void invalidateAll() {
        // no-op
    }

    @Override
    public CacheStats getStats() {
        return CacheStats.empty();
    }
}
