package com.contact.resolution.attribution;

/**
 * Configuration for the attribution cache.
 *
 * @param maxSize    maximum number of cached contacts
 * @param ttlSeconds time-to-live in seconds for each entry
 * @param enabled    whether caching is enabled
 */
public record AttributionCacheConfig(int maxSize, int ttlSeconds, boolean enabled) {

    public AttributionCacheConfig {
        if (maxSize <= 0) {
            throw new IllegalArgumentException("maxSize must be > 0");
        }
        if (ttlSeconds <= 0) {
            throw new IllegalArgumentException("ttlSeconds must be > 0");
        }
    }

    /**
     * 10,000 contacts, 300s TTL, enabled.
     */
    public static AttributionCacheConfig defaults() {
        return new AttributionCacheConfig(10_000, 300, true);
    }

    public static AttributionCacheConfig disabled() {
        return new AttributionCacheConfig(1, 1, false);
    }
}
