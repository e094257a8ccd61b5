package com.flagship.retainer_settlement.deal.event;

import java.time.Instant;
import java.util.UUID;

/**
 * Common shape of events about a deal.
 */
public interface DealEvent {

    /**
     * Unique per event instance, for consumer-side deduplication.
     */
    UUID getEventId();

    UUID getDealId();

    Instant getOccurredAt();

    String getEventType();
}
