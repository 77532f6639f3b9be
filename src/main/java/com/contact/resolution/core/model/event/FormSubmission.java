package com.contact.resolution.core.model.event;

import com.contact.resolution.core.model.SourcePlatform;

import java.time.Instant;
import java.util.Objects;

public record FormSubmission(
        String sourceId,
        SourcePlatform sourcePlatform,
        Instant timestamp,
        String formName
) implements Event {
    public FormSubmission {
        Objects.requireNonNull(sourceId, "sourceId is required");
        Objects.requireNonNull(sourcePlatform, "sourcePlatform is required");
        Objects.requireNonNull(timestamp, "timestamp is required");
    }

    @Override
    public EventType type() {
        return EventType.FORM_SUBMISSION;
    }
}
