package com.flagship.retainer_settlement.outbox;

import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * A row of the outbox: one serialized deal or invoice event and its delivery state.
 *
 * The id is the event's own id, so consumers see the same value in the payload and in the
 * {@code eventId} record header.
 */
@Value
public class OutboxEvent {
    UUID id;
    AggregateType aggregateType;
    UUID aggregateId;
    String eventType;
    String payload;
    String correlationId;
    Instant createdAt;
    Instant publishedAt;
    int retryCount;
    String lastError;
    Long sequenceNumber;

    static OutboxEvent pending(UUID eventId, AggregateType aggregateType, UUID aggregateId,
                               String eventType, String payload, String correlationId, Instant createdAt) {
        return new OutboxEvent(eventId, aggregateType, aggregateId, eventType, payload, correlationId,
                createdAt, null, 0, null, null);
    }

    /** Record key: events of one deal or invoice share a partition. */
    public String partitionKey() {
        return aggregateId.toString();
    }
}
