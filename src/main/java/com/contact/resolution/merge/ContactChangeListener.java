package com.contact.resolution.merge;

/**
 * Notified after a contact or its event links were committed.
 * Implementations must be fast and must not throw; failures are logged and ignored.
 */
@FunctionalInterface
public interface ContactChangeListener {

    void onContactChanged(String contactId);
}
