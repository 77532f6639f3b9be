package com.contact.resolution.lock;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

/**
 * In-process lock using one {@link ReentrantLock} per key. Reentrant, so a thread
 * holding an identity-key lock may also take the contact lock it resolves to.
 *
 * <p>A key's lock is dropped from the map when its last holder releases it and no thread
 * is queued on it. A thread that acquires a lock which was dropped in the meantime
 * releases it and retries against the current mapping.
 */
public class LocalContactLock implements ContactLock {
    private static final Logger log = LoggerFactory.getLogger(LocalContactLock.class);

    private final ConcurrentHashMap<String, ReentrantLock> locks = new ConcurrentHashMap<>();
    private final LockConfig config;

    public LocalContactLock() {
        this(LockConfig.defaults());
    }

    public LocalContactLock(LockConfig config) {
        this.config = config;
    }

    @Override
    public boolean tryLock(String key) {
        long deadline = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(config.timeoutMs());
        try {
            while (true) {
                ReentrantLock lock = locks.computeIfAbsent(key, k -> new ReentrantLock());
                long remaining = deadline - System.nanoTime();
                if (!lock.tryLock(Math.max(0L, remaining), TimeUnit.NANOSECONDS)) {
                    throw new LockAcquisitionException(
                            "Failed to acquire lock for key '" + key + "' within " + config.timeoutMs() + "ms");
                }
                if (locks.get(key) == lock) {
                    log.debug("lock.acquired key={}", key);
                    return true;
                }
                lock.unlock();
                log.trace("lock.evicted.retry key={}", key);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new LockAcquisitionException("Interrupted while acquiring lock for key: " + key, e);
        }
    }

    @Override
    public void unlock(String key) {
        ReentrantLock lock = locks.get(key);
        if (lock != null && lock.isHeldByCurrentThread()) {
            lock.unlock();
            locks.computeIfPresent(key, (k, l) -> l.isLocked() || l.hasQueuedThreads() ? l : null);
            log.debug("lock.released key={}", key);
        }
    }

    /**
     * Returns true if any thread currently holds the key.
     */
    public boolean isLocked(String key) {
        ReentrantLock lock = locks.get(key);
        return lock != null && lock.isLocked();
    }

    /**
     * Number of keys currently held or waited on.
     */
    public int size() {
        return locks.size();
    }
}
