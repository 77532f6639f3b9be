package com.contact.resolution.enhance;

import com.contact.resolution.core.model.SourcePlatform;
import com.contact.resolution.core.model.event.Deal;
import com.contact.resolution.core.model.event.DealStatus;
import com.contact.resolution.core.model.event.Event;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;

import static com.contact.resolution.TestEvents.*;
import static org.junit.jupiter.api.Assertions.*;

class DealEnhancerTest {

    private final DealEnhancer enhancer = new DealEnhancer();

    @Test
    @DisplayName("Won deal without cash gets its value as collected cash")
    void wonDealFilled() {
        Deal enhanced = enhancer.enhance(wonDeal("d1", 1, "2500"));

        assertEquals(new BigDecimal("2500"), enhanced.cashCollected());
    }

    @Test
    @DisplayName("Recorded cash is never overwritten")
    void recordedCashKept() {
        Deal deal = new Deal("d1", SourcePlatform.CLOSE, day(1), "Plan",
                new BigDecimal("2500"), new BigDecimal("1000"), DealStatus.WON);

        assertSame(deal, enhancer.enhance(deal));
    }

    @Test
    @DisplayName("Open deals and deals without value are untouched")
    void untouched() {
        Deal open = deal("d1", 1);
        Deal noValue = wonDeal("d2", 1, null);

        assertSame(open, enhancer.enhance(open));
        assertNull(enhancer.enhance(noValue).cashCollected());
    }

    @Test
    @DisplayName("Enhancing a list keeps order and non-deal events")
    void enhanceAll() {
        List<Event> events = List.of(meeting("m1", 1), wonDeal("d1", 2, "10"));

        List<Event> enhanced = enhancer.enhanceAll(events);

        assertSame(events.get(0), enhanced.get(0));
        assertEquals(new BigDecimal("10"), ((Deal) enhanced.get(1)).cashCollected());
    }
}
