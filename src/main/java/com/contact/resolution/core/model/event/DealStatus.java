package com.contact.resolution.core.model.event;

public enum DealStatus {
    OPEN,
    WON,
    LOST,
    PENDING
}
