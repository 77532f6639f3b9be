package com.contact.resolution.attribution;

import com.contact.resolution.core.model.event.Event;

import java.util.Objects;

/**
 * A touchpoint with its share of a deal's credit.
 */
public record WeightedTouchpoint(Event event, int position, double weight) {
    public WeightedTouchpoint {
        Objects.requireNonNull(event, "event is required");
        if (weight < 0.0 || weight > 1.0) {
            throw new IllegalArgumentException("weight must be between 0.0 and 1.0");
        }
    }
}
