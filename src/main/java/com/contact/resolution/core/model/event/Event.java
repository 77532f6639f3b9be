package com.contact.resolution.core.model.event;

import com.contact.resolution.core.model.SourcePlatform;

import java.time.Instant;

/**
 * A timestamped touchpoint owned by exactly one contact.
 * Ownership is tracked by the event store, keyed by {@link #key()}.
 */
public sealed interface Event permits Activity, Meeting, FormSubmission, Deal {

    EventType type();

    Instant timestamp();

    SourcePlatform sourcePlatform();

    String sourceId();

    default EventKey key() {
        return new EventKey(sourcePlatform(), sourceId());
    }
}
