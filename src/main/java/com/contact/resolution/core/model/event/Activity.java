package com.contact.resolution.core.model.event;

import com.contact.resolution.core.model.SourcePlatform;

import java.time.Instant;
import java.util.Objects;

/**
 * CRM activity such as a call, email or note.
 */
public record Activity(
        String sourceId,
        SourcePlatform sourcePlatform,
        Instant timestamp,
        String activityType,
        String subject
) implements Event {
    public Activity {
        Objects.requireNonNull(sourceId, "sourceId is required");
        Objects.requireNonNull(sourcePlatform, "sourcePlatform is required");
        Objects.requireNonNull(timestamp, "timestamp is required");
    }

    @Override
    public EventType type() {
        return EventType.ACTIVITY;
    }
}
