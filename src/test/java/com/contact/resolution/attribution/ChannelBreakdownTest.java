package com.contact.resolution.attribution;

import com.contact.resolution.core.model.SourcePlatform;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.contact.resolution.TestEvents.*;
import static org.junit.jupiter.api.Assertions.*;

class ChannelBreakdownTest {

    @Test
    @DisplayName("Shares and influence per platform")
    void sharesAndInfluence() {
        ChannelBreakdown breakdown = ChannelBreakdown.of(
                List.of(form("f1", 1), meeting("m1", 2), meeting("m2", 3), activity("a1", 4)));

        assertEquals(4, breakdown.total());
        assertEquals(2, breakdown.count(SourcePlatform.CALENDLY));
        assertEquals(0.5, breakdown.share(SourcePlatform.CALENDLY), 0.0001);
        assertEquals(0.425, breakdown.influence(SourcePlatform.CALENDLY), 0.0001);
        assertEquals(0.15, breakdown.influence(SourcePlatform.TYPEFORM), 0.0001);
    }

    @Test
    @DisplayName("Sole channel influence equals its signal strength")
    void soleChannel() {
        ChannelBreakdown breakdown = ChannelBreakdown.of(List.of(meeting("m1", 1)));

        assertEquals(0.85, breakdown.influence(SourcePlatform.CALENDLY), 0.0001);
    }

    @Test
    @DisplayName("Empty breakdown has zero shares")
    void empty() {
        ChannelBreakdown breakdown = ChannelBreakdown.of(List.of());

        assertEquals(0.0, breakdown.share(SourcePlatform.CLOSE));
        assertEquals(0, breakdown.count(SourcePlatform.CLOSE));
    }
}
