package com.contact.resolution.core.model.event;

import com.contact.resolution.core.model.SourcePlatform;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Objects;

/**
 * Monetary outcome. Attribution chains are built per deal.
 *
 * @param value         deal value, or null if unknown
 * @param cashCollected cash actually collected, or null if not recorded
 */
public record Deal(
        String sourceId,
        SourcePlatform sourcePlatform,
        Instant timestamp,
        String title,
        BigDecimal value,
        BigDecimal cashCollected,
        DealStatus status
) implements Event {
    public Deal {
        Objects.requireNonNull(sourceId, "sourceId is required");
        Objects.requireNonNull(sourcePlatform, "sourcePlatform is required");
        Objects.requireNonNull(timestamp, "timestamp is required");
        status = status != null ? status : DealStatus.OPEN;
    }

    @Override
    public EventType type() {
        return EventType.DEAL;
    }

    public Deal withCashCollected(BigDecimal amount) {
        return new Deal(sourceId, sourcePlatform, timestamp, title, value, amount, status);
    }

    public boolean isWon() {
        return status == DealStatus.WON;
    }
}
