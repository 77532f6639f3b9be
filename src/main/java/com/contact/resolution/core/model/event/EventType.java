package com.contact.resolution.core.model.event;

/**
 * Closed set of touchpoint kinds.
 */
public enum EventType {
    ACTIVITY,
    MEETING,
    FORM_SUBMISSION,
    DEAL
}
