package com.contact.resolution.lock;

import java.util.function.Supplier;

/**
 * Per-key mutual exclusion serializing the read-modify-write of one contact.
 * Keys are identity keys ({@code email:...}) before a contact exists and
 * {@code contact:<id>} once it does.
 */
public interface ContactLock {

    /**
     * Acquires the lock for the key, waiting up to the configured timeout.
     *
     * @return true once the lock is held
     * @throws LockAcquisitionException if the lock is not acquired in time or the wait is interrupted
     */
    boolean tryLock(String key);

    /**
     * Releases the lock if the current thread holds it.
     */
    void unlock(String key);

    /**
     * Runs the action while holding the key's lock.
     */
    default <T> T withLock(String key, Supplier<T> action) {
        tryLock(key);
        try {
            return action.get();
        } finally {
            unlock(key);
        }
    }

    static String contactKey(String contactId) {
        return "contact:" + contactId;
    }
}
