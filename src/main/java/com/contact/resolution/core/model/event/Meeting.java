package com.contact.resolution.core.model.event;

import com.contact.resolution.core.model.SourcePlatform;

import java.time.Instant;
import java.util.Objects;

/**
 * Scheduled meeting. {@code timestamp} is the meeting start time.
 */
public record Meeting(
        String sourceId,
        SourcePlatform sourcePlatform,
        Instant timestamp,
        String title,
        MeetingStatus status,
        int durationMinutes
) implements Event {
    public Meeting {
        Objects.requireNonNull(sourceId, "sourceId is required");
        Objects.requireNonNull(sourcePlatform, "sourcePlatform is required");
        Objects.requireNonNull(timestamp, "timestamp is required");
        status = status != null ? status : MeetingStatus.SCHEDULED;
        if (durationMinutes < 0) {
            throw new IllegalArgumentException("durationMinutes must be >= 0");
        }
    }

    @Override
    public EventType type() {
        return EventType.MEETING;
    }

    public boolean isCanceled() {
        return status == MeetingStatus.CANCELED;
    }
}
