package com.contact.resolution.enhance;

import com.contact.resolution.core.model.event.Meeting;

import java.util.Objects;

/**
 * A meeting with its 1-based position in the contact's meeting history.
 */
public record SequencedMeeting(Meeting meeting, int sequenceNumber, MeetingStage stage) {
    public SequencedMeeting {
        Objects.requireNonNull(meeting, "meeting is required");
        Objects.requireNonNull(stage, "stage is required");
        if (sequenceNumber < 1) {
            throw new IllegalArgumentException("sequenceNumber must be >= 1");
        }
    }
}
