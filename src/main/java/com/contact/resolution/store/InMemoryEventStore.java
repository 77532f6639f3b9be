package com.contact.resolution.store;

import com.contact.resolution.core.model.event.Event;
import com.contact.resolution.core.model.event.EventKey;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Thread-safe in-memory event store keyed by {@link EventKey}.
 */
public class InMemoryEventStore implements EventStore {

    private final ConcurrentMap<EventKey, LinkedEvent> events = new ConcurrentHashMap<>();

    @Override
    public Optional<LinkedEvent> upsert(Event event, String contactId) {
        Objects.requireNonNull(event, "event is required");
        return Optional.ofNullable(events.put(event.key(), new LinkedEvent(event, contactId)));
    }

    @Override
    public Optional<String> linkEvent(EventKey key, String contactId) {
        String[] previousOwner = new String[1];
        events.computeIfPresent(key, (k, linked) -> {
            previousOwner[0] = linked.contactId();
            return new LinkedEvent(linked.event(), contactId);
        });
        return Optional.ofNullable(previousOwner[0]);
    }

    @Override
    public List<Event> eventsForContact(String contactId) {
        return events.values().stream()
                .filter(linked -> linked.contactId().equals(contactId))
                .map(LinkedEvent::event)
                .toList();
    }

    @Override
    public Optional<LinkedEvent> find(EventKey key) {
        return Optional.ofNullable(events.get(key));
    }

    @Override
    public void remove(EventKey key) {
        events.remove(key);
    }

    public int size() {
        return events.size();
    }
}
