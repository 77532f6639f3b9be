package com.contact.resolution.attribution;

import com.contact.resolution.merge.ContactChangeListener;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Caffeine-backed attribution cache. Registers as a {@link ContactChangeListener}
 * so a committed write to a contact drops its chains.
 *
 * <p>Each contact carries a generation that invalidation bumps before dropping the entry.
 * A put made with an older generation is discarded, so chains computed from events read
 * before a concurrent write never outlive that write.</p>
 */
public class CaffeineAttributionCache implements AttributionCache, ContactChangeListener {
    private static final Logger log = LoggerFactory.getLogger(CaffeineAttributionCache.class);

    private final Cache<String, List<AttributionChain>> cache;
    private final ConcurrentMap<String, Long> generations = new ConcurrentHashMap<>();
    private final AtomicLong epoch = new AtomicLong();

    public CaffeineAttributionCache(AttributionCacheConfig config) {
        this.cache = Caffeine.newBuilder()
                .maximumSize(config.maxSize())
                .expireAfterWrite(Duration.ofSeconds(config.ttlSeconds()))
                .recordStats()
                .build();
        log.info("cache.initialized maxSize={} ttl={}s", config.maxSize(), config.ttlSeconds());
    }

    @Override
    public Optional<List<AttributionChain>> get(String contactId) {
        return Optional.ofNullable(cache.getIfPresent(contactId));
    }

    @Override
    public long generation(String contactId) {
        return generations.getOrDefault(contactId, 0L) + epoch.get();
    }

    @Override
    public boolean put(String contactId, long generation, List<AttributionChain> chains) {
        List<AttributionChain> copy = List.copyOf(chains);
        AtomicBoolean stored = new AtomicBoolean();
        generations.compute(contactId, (key, current) -> {
            long now = (current != null ? current : 0L) + epoch.get();
            if (now == generation) {
                cache.put(key, copy);
                stored.set(true);
            }
            return current;
        });
        if (!stored.get()) {
            log.debug("cache.put.stale contactId={} generation={}", contactId, generation);
        }
        return stored.get();
    }

    @Override
    public void invalidate(String contactId) {
        generations.merge(contactId, 1L, Long::sum);
        cache.invalidate(contactId);
        log.debug("cache.invalidated contactId={}", contactId);
    }

    @Override
    public void invalidateAll() {
        epoch.incrementAndGet();
        cache.invalidateAll();
        log.debug("cache.invalidated.all");
    }

    @Override
    public CacheStats getStats() {
        com.github.benmanes.caffeine.cache.stats.CacheStats caffeineStats = cache.stats();
        return new CacheStats(
                caffeineStats.hitCount(),
                caffeineStats.missCount(),
                caffeineStats.evictionCount(),
                cache.estimatedSize()
        );
    }

    @Override
    public void onContactChanged(String contactId) {
        invalidate(contactId);
    }
}
