package com.flagship.retainer_settlement.outbox;

import com.flagship.retainer_settlement.observability.CorrelationContext;
import com.flagship.retainer_settlement.observability.OutboxMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.clients.producer.RecordMetadata;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.kafka.KafkaException;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.util.concurrent.ExecutionException;

/**
 * Drains the outbox to Kafka on a fixed delay.
 *
 * Deal events go to the settlement topic, invoice events to the invoice topic, keyed by the
 * aggregate id. Each record carries {@code eventId}, {@code eventType} and, when the change came
 * from an API request, {@code X-Correlation-ID} headers. A send that fails stays in the outbox
 * and is picked up again on a later poll until it runs out of retries. Delivery is at least
 * once: a crash between the broker's acknowledgement and the batch commit resends the event,
 * and consumers deduplicate on {@code eventId}.
 */
@Component
@ConditionalOnProperty(name = "outbox.publisher.enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class OutboxPublisher {

    static final String EVENT_ID_HEADER = "eventId";
    static final String EVENT_TYPE_HEADER = "eventType";

    private final OutboxService outboxService;
    private final KafkaTemplate<String, String> kafkaTemplate;
    private final OutboxMetrics outboxMetrics;

    @Value("${kafka.topic.settlement-events:settlement-events}")
    private String settlementTopic;

    @Value("${kafka.topic.invoice-events:invoice-events}")
    private String invoiceTopic;

    @Value("${outbox.publisher.batch-size:100}")
    private int batchSize;

    @Value("${outbox.publisher.max-retries:5}")
    private int maxRetries;

    @Scheduled(fixedDelayString = "${outbox.publisher.poll-interval-ms:1000}")
    public void publishPendingEvents() {
        int delivered = outboxService.deliverNextBatch(batchSize, maxRetries, this::deliver);
        if (delivered > 0) {
            log.debug("Delivered {} outbox events", delivered);
        }
    }

    /**
     * Sends one event and waits for the broker's acknowledgement.
     *
     * @throws KafkaException carrying the broker's failure message
     */
    void deliver(OutboxEvent event) throws InterruptedException {
        if (event.getCorrelationId() != null) {
            MDC.put(CorrelationContext.CORRELATION_ID_MDC_KEY, event.getCorrelationId());
        }
        try {
            RecordMetadata metadata = kafkaTemplate.send(toRecord(event)).get().getRecordMetadata();
            outboxMetrics.recordEventPublished(event.getEventType());
            log.debug("Delivered {} {} to {}-{}@{}", event.getEventType(), event.getId(),
                    metadata.topic(), metadata.partition(), metadata.offset());
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            throw failed(event, cause);
        } catch (RuntimeException e) {
            throw failed(event, e);
        } finally {
            MDC.remove(CorrelationContext.CORRELATION_ID_MDC_KEY);
        }
    }

    private KafkaException failed(OutboxEvent event, Throwable cause) {
        log.error("Could not deliver {} {}: {}", event.getEventType(), event.getId(), cause.getMessage());
        outboxMetrics.recordEventPublishFailed(event.getEventType());
        return new KafkaException(cause.getMessage(), cause);
    }

    ProducerRecord<String, String> toRecord(OutboxEvent event) {
        ProducerRecord<String, String> record =
                new ProducerRecord<>(topicFor(event.getAggregateType()), event.partitionKey(), event.getPayload());
        record.headers().add(EVENT_ID_HEADER, bytes(event.getId().toString()));
        record.headers().add(EVENT_TYPE_HEADER, bytes(event.getEventType()));
        if (event.getCorrelationId() != null) {
            record.headers().add(CorrelationContext.CORRELATION_ID_HEADER, bytes(event.getCorrelationId()));
        }
        return record;
    }

    String topicFor(AggregateType aggregateType) {
        return switch (aggregateType) {
            case DEAL -> settlementTopic;
            case INVOICE -> invoiceTopic;
        };
    }

    private static byte[] bytes(String value) {
        return value.getBytes(StandardCharsets.UTF_8);
    }
}
