package com.contact.resolution.store;

import com.contact.resolution.core.model.event.Event;
import com.contact.resolution.core.model.event.EventKey;

import java.util.List;
import java.util.Optional;

/**
 * Event persistence. An event is identified by its {@link EventKey}; storing the same key
 * again replaces it in place.
 */
public interface EventStore {

    /**
     * Stores the event and links it to the contact.
     *
     * @return the previously stored event with that key, if any
     */
    Optional<LinkedEvent> upsert(Event event, String contactId);

    /**
     * Re-links an existing event to a contact.
     *
     * @return the previous owner, if the event existed
     */
    Optional<String> linkEvent(EventKey key, String contactId);

    List<Event> eventsForContact(String contactId);

    Optional<LinkedEvent> find(EventKey key);

    /**
     * Removes an event. Only used to roll back an uncommitted insert.
     */
    void remove(EventKey key);
}
