package com.contact.resolution.attribution;

import com.contact.resolution.core.model.SourcePlatform;
import com.contact.resolution.core.model.event.Activity;
import com.contact.resolution.core.model.event.Deal;
import com.contact.resolution.core.model.event.Event;
import com.contact.resolution.core.model.event.FormSubmission;
import com.contact.resolution.core.model.event.Meeting;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Builds one {@link AttributionChain} per deal from a contact's cross-platform events.
 * Pure with respect to its inputs; chains share no mutable state.
 */
public class AttributionChainBuilder {
    private static final Logger log = LoggerFactory.getLogger(AttributionChainBuilder.class);

    private static final Comparator<Event> BY_TIMESTAMP = Comparator.comparing(Event::timestamp);

    private final Clock clock;

    public AttributionChainBuilder() {
        this(Clock.systemUTC());
    }

    public AttributionChainBuilder(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock is required");
    }

    /**
     * Orders events ascending by timestamp. Events with equal timestamps keep input order.
     */
    public List<Event> timeline(Collection<? extends Event> events) {
        List<Event> ordered = new ArrayList<>(events);
        ordered.sort(BY_TIMESTAMP);
        return ordered;
    }

    /**
     * Builds a chain for every deal among the events, in deal timestamp order.
     * A deal with no earlier touchpoint still gets an empty multi-touch chain.
     */
    public List<AttributionChain> buildChains(String contactId, Collection<? extends Event> events) {
        Objects.requireNonNull(contactId, "contactId is required");
        List<Event> ordered = timeline(events);
        Instant computedAt = clock.instant();

        List<AttributionChain> chains = new ArrayList<>();
        for (Event event : ordered) {
            if (event instanceof Deal deal) {
                chains.add(buildChain(contactId, deal, ordered, computedAt));
            }
        }
        log.debug("attribution.built contactId={} events={} chains={}", contactId, ordered.size(), chains.size());
        return chains;
    }

    private AttributionChain buildChain(String contactId, Deal deal, List<Event> ordered, Instant computedAt) {
        List<Event> prior = new ArrayList<>();
        Meeting lastMeeting = null;
        FormSubmission lastForm = null;
        Activity lastActivity = null;
        Map<SourcePlatform, Integer> counts = new EnumMap<>(SourcePlatform.class);

        for (Event event : ordered) {
            if (event instanceof Deal || event.timestamp().isAfter(deal.timestamp())) {
                continue;
            }
            prior.add(event);
            counts.merge(event.sourcePlatform(), 1, Integer::sum);
            if (event instanceof Meeting meeting) {
                lastMeeting = meeting;
            } else if (event instanceof FormSubmission form) {
                lastForm = form;
            } else if (event instanceof Activity activity) {
                lastActivity = activity;
            }
        }

        AttributionModel model = lastMeeting != null ? AttributionModel.LAST_TOUCH : AttributionModel.MULTI_TOUCH;
        Long days = lastMeeting != null
                ? Duration.between(lastMeeting.timestamp(), deal.timestamp()).toDays()
                : null;

        return new AttributionChain(contactId, deal, prior, model, lastMeeting,
                lastMeeting, lastForm, lastActivity, days, counts, computedAt, null);
    }
}
