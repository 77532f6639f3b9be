package com.contact.resolution.core.model.event;

import com.contact.resolution.core.model.SourcePlatform;

import java.util.Objects;

/**
 * Unique identity of an event: the external id within its platform.
 */
public record EventKey(SourcePlatform platform, String sourceId) {
    public EventKey {
        Objects.requireNonNull(platform, "platform is required");
        Objects.requireNonNull(sourceId, "sourceId is required");
        if (sourceId.isBlank()) {
            throw new IllegalArgumentException("sourceId must not be blank");
        }
    }

    @Override
    public String toString() {
        return platform.tag() + ":" + sourceId;
    }
}
