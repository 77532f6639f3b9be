package com.contact.resolution.store;

import com.contact.resolution.core.model.event.Event;

import java.util.Objects;

/**
 * An event together with the contact that owns it.
 */
public record LinkedEvent(Event event, String contactId) {
    public LinkedEvent {
        Objects.requireNonNull(event, "event is required");
        Objects.requireNonNull(contactId, "contactId is required");
    }
}
