package com.contact.resolution.enhance;

import com.contact.resolution.core.model.event.Deal;
import com.contact.resolution.core.model.event.Event;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Fills in cash collected on won deals that only record a value.
 */
public class DealEnhancer {
    private static final Logger log = LoggerFactory.getLogger(DealEnhancer.class);

    /**
     * A won deal with a value and no cash collected gets {@code cashCollected = value};
     * every other deal is returned unchanged.
     */
    public Deal enhance(Deal deal) {
        if (deal.isWon() && deal.cashCollected() == null && deal.value() != null) {
            log.debug("deal.enhanced key={} cashCollected={}", deal.key(), deal.value());
            return deal.withCashCollected(deal.value());
        }
        return deal;
    }

    /**
     * Applies {@link #enhance(Deal)} to every deal among the events, keeping order.
     */
    public List<Event> enhanceAll(Collection<? extends Event> events) {
        List<Event> result = new ArrayList<>(events.size());
        for (Event event : events) {
            result.add(event instanceof Deal deal ? enhance(deal) : event);
        }
        return result;
    }
}
