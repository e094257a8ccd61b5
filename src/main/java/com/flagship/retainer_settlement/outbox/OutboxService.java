package com.flagship.retainer_settlement.outbox;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.retainer_settlement.deal.event.DealEvent;
import com.flagship.retainer_settlement.invoice.event.InvoiceEvent;
import com.flagship.retainer_settlement.observability.CorrelationContext;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

/**
 * Transactional access to the outbox table.
 *
 * Recording happens inside the transaction that changes the deal or invoice, so the event
 * exists exactly when the change does. Delivery runs batch by batch on behalf of
 * {@link OutboxPublisher}, one transaction per batch.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class OutboxService {

    // Kafka client messages can embed whole stack traces
    private static final int MAX_ERROR_LENGTH = 2000;

    private final OutboxEventRepository repository;
    private final ObjectMapper objectMapper;

    @Transactional(propagation = Propagation.MANDATORY)
    public void recordDealEvent(DealEvent event) {
        append(OutboxEvent.pending(event.getEventId(), AggregateType.DEAL, event.getDealId(),
                event.getEventType(), toJson(event), currentCorrelationId(), event.getOccurredAt()));
    }

    @Transactional(propagation = Propagation.MANDATORY)
    public void recordInvoiceEvent(InvoiceEvent event) {
        append(OutboxEvent.pending(event.getEventId(), AggregateType.INVOICE, event.getInvoiceId(),
                event.getEventType(), toJson(event), currentCorrelationId(), event.getOccurredAt()));
    }

    /**
     * Hands one event to the broker. Returning normally means the event was delivered.
     */
    @FunctionalInterface
    public interface Delivery {
        void deliver(OutboxEvent event) throws Exception;
    }

    /**
     * Locks up to {@code limit} undelivered events that still have retries left, oldest first,
     * and passes each to {@code delivery} while the row locks are held. Another publisher
     * instance skips these rows until this batch commits, so no event is sent twice by
     * concurrent pollers. A delivery that throws leaves its event pending with one more retry used.
     *
     * @return number of events delivered
     */
    @Transactional
    public int deliverNextBatch(int limit, int maxRetries, Delivery delivery) {
        List<OutboxEventEntity> batch = repository.lockNextBatch(limit, maxRetries);
        int delivered = 0;
        for (OutboxEventEntity row : batch) {
            try {
                delivery.deliver(row.toDomain());
                row.markPublished();
                delivered++;
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                failed(row, "Interrupted while waiting for the broker");
                break;
            } catch (Exception e) {
                failed(row, e.getMessage());
            }
        }
        return delivered;
    }

    private void failed(OutboxEventEntity row, String errorMessage) {
        row.markFailed(abbreviate(errorMessage));
        log.warn("Delivery of outbox event {} ({}) failed, attempt {}: {}",
                row.getId(), row.getEventType(), row.getRetryCount(), errorMessage);
    }

    private void append(OutboxEvent event) {
        repository.save(OutboxEventEntity.fromDomain(event));
        log.debug("Recorded {} for {} {}", event.getEventType(),
                event.getAggregateType().getStoredName(), event.getAggregateId());
    }

    private String toJson(Object event) {
        try {
            return objectMapper.writeValueAsString(event);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Cannot serialize " + event.getClass().getSimpleName(), e);
        }
    }

    private static String currentCorrelationId() {
        return CorrelationContext.current().orElse(null);
    }

    private static String abbreviate(String message) {
        if (message == null || message.length() <= MAX_ERROR_LENGTH) {
            return message;
        }
        return message.substring(0, MAX_ERROR_LENGTH);
    }
}
