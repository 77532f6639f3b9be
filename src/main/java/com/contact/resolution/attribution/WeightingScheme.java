package com.contact.resolution.attribution;

import com.contact.resolution.core.model.event.Event;
import com.contact.resolution.core.model.event.EventType;

import java.util.List;

/**
 * First, middle and last-position credit shares used to weigh a chain's touchpoints.
 */
public enum WeightingScheme {
    FIRST_TOUCH(1.0, 0.0, 0.0),
    LAST_TOUCH(0.0, 0.0, 1.0),
    LINEAR(0.33, 0.34, 0.33),
    U_SHAPED(0.4, 0.2, 0.4),
    W_SHAPED(0.3, 0.4, 0.3),
    MULTI_TOUCH(0.25, 0.5, 0.25);

    private final double first;
    private final double middle;
    private final double last;

    WeightingScheme(double first, double middle, double last) {
        this.first = first;
        this.middle = middle;
        this.last = last;
    }

    public double first() {
        return first;
    }

    public double middle() {
        return middle;
    }

    public double last() {
        return last;
    }

    /**
     * Picks a scheme from the shape of the journey: a single touchpoint or none is first-touch,
     * meetings mixed with activities are W-shaped, three or more touchpoints are U-shaped,
     * and two are linear.
     */
    public static WeightingScheme suggest(List<? extends Event> touchpoints) {
        if (touchpoints.size() <= 1) {
            return FIRST_TOUCH;
        }
        boolean meetings = touchpoints.stream().anyMatch(e -> e.type() == EventType.MEETING);
        boolean activities = touchpoints.stream().anyMatch(e -> e.type() == EventType.ACTIVITY);
        if (meetings && activities) {
            return W_SHAPED;
        }
        if (touchpoints.size() >= 3) {
            return U_SHAPED;
        }
        return LINEAR;
    }
}
