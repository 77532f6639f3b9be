package com.contact.resolution.attribution;

import com.contact.resolution.core.model.Contact;
import com.contact.resolution.core.model.SourcePlatform;
import com.contact.resolution.core.model.event.Event;
import com.contact.resolution.core.model.event.EventType;

import java.util.Collection;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Scores how well a contact's evidence supports an attribution, in [0, 0.98].
 *
 * <p>A base of 0.7 is raised by five factors:</p>
 * <ul>
 *   <li>data completeness: name and email, last activity, company and title, notes</li>
 *   <li>channel diversity: how many platforms the touchpoints come from</li>
 *   <li>timeline clarity: how many touchpoints there are</li>
 *   <li>touchpoint signal: meetings over activities over forms, weighted by channel</li>
 *   <li>cross-platform confirmation: how many platforms the contact was sourced from</li>
 * </ul>
 */
public final class AttributionCertainty {

    public static final double HIGH_CERTAINTY = 0.9;

    static final double BASE = 0.7;
    static final double EMPTY_CHAIN = 0.5;
    static final double MAX = 0.98;

    private static final double FACTOR_FLOOR = 0.05;
    private static final double FACTOR_CAP = 0.2;

    private AttributionCertainty() {
    }

    /**
     * Certainty of one chain; a chain without touchpoints scores {@value #EMPTY_CHAIN}.
     */
    public static double forChain(Contact contact, AttributionChain chain) {
        if (!chain.hasTouchpoints()) {
            return EMPTY_CHAIN;
        }
        return score(contact, chain.priorEvents());
    }

    /**
     * Certainty of a contact: the best of its scored chains, or, without deals, the score of
     * all its non-deal events.
     */
    public static double forContact(Contact contact, List<AttributionChain> chains,
                                    Collection<? extends Event> events) {
        double best = -1.0;
        for (AttributionChain chain : chains) {
            double value = chain.isScored() ? chain.certainty() : forChain(contact, chain);
            best = Math.max(best, value);
        }
        if (best >= 0.0) {
            return best;
        }
        return score(contact, events.stream().filter(e -> e.type() != EventType.DEAL).toList());
    }

    static double score(Contact contact, Collection<? extends Event> touchpoints) {
        double total = BASE
                + completeness(contact)
                + channelDiversity(touchpoints)
                + timelineClarity(touchpoints.size())
                + touchpointSignal(touchpoints)
                + crossPlatform(contact.getSourcesCount());
        return Math.min(MAX, total);
    }

    static double completeness(Contact contact) {
        double value = FACTOR_FLOOR;
        if (contact.hasName() && contact.hasEmail()) value += 0.05;
        if (contact.getLastActivityDate() != null) value += 0.05;
        if (contact.getCompany() != null && contact.getTitle() != null) value += 0.05;
        if (contact.getNotes() != null && !contact.getNotes().isEmpty()) value += 0.05;
        return value;
    }

    static double channelDiversity(Collection<? extends Event> touchpoints) {
        Set<SourcePlatform> platforms = EnumSet.noneOf(SourcePlatform.class);
        touchpoints.forEach(e -> platforms.add(e.sourcePlatform()));
        if (platforms.size() >= 2) {
            return FACTOR_CAP;
        }
        return platforms.size() == 1 ? 0.1 : FACTOR_FLOOR;
    }

    static double timelineClarity(int touchpoints) {
        if (touchpoints >= 5) {
            return FACTOR_CAP;
        }
        if (touchpoints >= 2) {
            return 0.1 + (touchpoints - 2) * 0.03;
        }
        return FACTOR_FLOOR;
    }

    static double touchpointSignal(Collection<? extends Event> touchpoints) {
        double signal = 0.0;
        for (Event event : touchpoints) {
            double channel = ChannelBreakdown.signalStrength(event.sourcePlatform());
            signal += switch (event.type()) {
                case MEETING -> channel * 0.05;
                case ACTIVITY -> channel * 0.03;
                default -> channel * 0.02;
            };
        }
        return Math.min(FACTOR_CAP, signal);
    }

    static double crossPlatform(int sourcesCount) {
        if (sourcesCount >= 3) {
            return FACTOR_CAP;
        }
        return sourcesCount == 2 ? 0.15 : FACTOR_FLOOR;
    }
}
