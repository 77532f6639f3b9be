package com.contact.resolution.attribution;

import com.contact.resolution.core.model.SourcePlatform;
import com.contact.resolution.core.model.event.Event;

import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Per-platform share of a set of touchpoints.
 *
 * @param total  number of touchpoints
 * @param counts touchpoints per platform, every platform present
 */
public record ChannelBreakdown(int total, Map<SourcePlatform, Integer> counts) {

    private static final double MAX_INFLUENCE = 0.9;

    public ChannelBreakdown {
        counts = Collections.unmodifiableMap(new EnumMap<>(counts));
    }

    public static ChannelBreakdown of(Collection<? extends Event> touchpoints) {
        Map<SourcePlatform, Integer> counts = new EnumMap<>(SourcePlatform.class);
        for (SourcePlatform platform : SourcePlatform.values()) {
            counts.put(platform, 0);
        }
        for (Event event : touchpoints) {
            counts.merge(event.sourcePlatform(), 1, Integer::sum);
        }
        return new ChannelBreakdown(touchpoints.size(), counts);
    }

    public static ChannelBreakdown of(AttributionChain chain) {
        return of(chain.priorEvents());
    }

    public int count(SourcePlatform platform) {
        return counts.getOrDefault(platform, 0);
    }

    /**
     * Fraction of touchpoints from the platform, 0.0 when there are none.
     */
    public double share(SourcePlatform platform) {
        return total == 0 ? 0.0 : (double) count(platform) / total;
    }

    /**
     * Share scaled by how strong a signal the platform's touchpoints are
     * (meetings above CRM activity above forms), capped at 0.9.
     */
    public double influence(SourcePlatform platform) {
        return Math.min(MAX_INFLUENCE, share(platform) * signalStrength(platform));
    }

    static double signalStrength(SourcePlatform platform) {
        return switch (platform) {
            case CALENDLY -> 0.85;
            case CLOSE -> 0.75;
            case TYPEFORM -> 0.6;
        };
    }
}
