package com.flagship.retainer_settlement.outbox;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.Instant;
import java.util.UUID;

@Entity
@Table(name = "outbox_events")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class OutboxEventEntity {

    @Id
    private UUID id;

    @Column(name = "aggregate_type", nullable = false, updatable = false)
    private String aggregateType;

    @Column(name = "aggregate_id", nullable = false, updatable = false)
    private UUID aggregateId;

    @Column(name = "event_type", nullable = false, updatable = false)
    private String eventType;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(nullable = false, updatable = false)
    private String payload;

    @Column(name = "correlation_id", updatable = false)
    private String correlationId;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "published_at")
    private Instant publishedAt;

    @Column(name = "retry_count", nullable = false)
    private int retryCount;

    @Column(name = "last_error", columnDefinition = "TEXT")
    private String lastError;

    // BIGSERIAL, fixes the publishing order
    @Column(name = "sequence_number", insertable = false, updatable = false)
    private Long sequenceNumber;

    static OutboxEventEntity fromDomain(OutboxEvent event) {
        OutboxEventEntity row = new OutboxEventEntity();
        row.id = event.getId();
        row.aggregateType = event.getAggregateType().getStoredName();
        row.aggregateId = event.getAggregateId();
        row.eventType = event.getEventType();
        row.payload = event.getPayload();
        row.correlationId = event.getCorrelationId();
        row.createdAt = event.getCreatedAt();
        row.retryCount = event.getRetryCount();
        return row;
    }

    OutboxEvent toDomain() {
        return new OutboxEvent(id, AggregateType.fromStoredName(aggregateType), aggregateId, eventType,
                payload, correlationId, createdAt, publishedAt, retryCount, lastError, sequenceNumber);
    }

    void markPublished() {
        publishedAt = Instant.now();
        lastError = null;
    }

    void markFailed(String error) {
        retryCount += 1;
        lastError = error;
    }
}
