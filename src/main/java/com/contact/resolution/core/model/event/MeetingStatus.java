package com.contact.resolution.core.model.event;

public enum MeetingStatus {
    SCHEDULED,
    COMPLETED,
    CANCELED
}
