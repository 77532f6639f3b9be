package com.contact.resolution.attribution;

import com.contact.resolution.core.model.SourcePlatform;
import com.contact.resolution.core.model.event.Activity;
import com.contact.resolution.core.model.event.Deal;
import com.contact.resolution.core.model.event.Event;
import com.contact.resolution.core.model.event.FormSubmission;
import com.contact.resolution.core.model.event.Meeting;

import java.time.Instant;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Ordered evidence of the touchpoints that preceded one deal.
 * Derived data: recomputed on request, identified only by deal and computation time.
 *
 * @param priorEvents        non-deal events at or before the deal, ascending by time
 * @param primaryTouchpoint  the last meeting under {@link AttributionModel#LAST_TOUCH}, otherwise null
 * @param daysToConversion   whole days from the last meeting to the deal, null without a meeting
 * @param channelCounts      prior events per platform; every platform is present
 * @param certainty          confidence in the chain's evidence in [0, 1], null until scored
 */
public record AttributionChain(
        String contactId,
        Deal deal,
        List<Event> priorEvents,
        AttributionModel model,
        Event primaryTouchpoint,
        Meeting lastMeeting,
        FormSubmission lastForm,
        Activity lastActivity,
        Long daysToConversion,
        Map<SourcePlatform, Integer> channelCounts,
        Instant computedAt,
        Double certainty
) {
    public AttributionChain {
        Objects.requireNonNull(contactId, "contactId is required");
        Objects.requireNonNull(deal, "deal is required");
        Objects.requireNonNull(model, "model is required");
        Objects.requireNonNull(computedAt, "computedAt is required");
        if (certainty != null && (certainty < 0.0 || certainty > 1.0)) {
            throw new IllegalArgumentException("certainty must be between 0.0 and 1.0");
        }
        priorEvents = priorEvents != null ? List.copyOf(priorEvents) : List.of();
        Map<SourcePlatform, Integer> counts = new EnumMap<>(SourcePlatform.class);
        for (SourcePlatform platform : SourcePlatform.values()) {
            counts.put(platform, channelCounts != null ? channelCounts.getOrDefault(platform, 0) : 0);
        }
        channelCounts = Collections.unmodifiableMap(counts);
    }

    public AttributionChain withCertainty(double value) {
        return new AttributionChain(contactId, deal, priorEvents, model, primaryTouchpoint, lastMeeting,
                lastForm, lastActivity, daysToConversion, channelCounts, computedAt, value);
    }

    public boolean isScored() {
        return certainty != null;
    }

    public int touchpointCount() {
        return priorEvents.size();
    }

    public boolean hasTouchpoints() {
        return !priorEvents.isEmpty();
    }

    /**
     * @return the earliest prior event, or null for an empty chain
     */
    public Event firstTouch() {
        return priorEvents.isEmpty() ? null : priorEvents.get(0);
    }

    /**
     * @return the latest prior event, or null for an empty chain
     */
    public Event lastTouch() {
        return priorEvents.isEmpty() ? null : priorEvents.get(priorEvents.size() - 1);
    }
}
