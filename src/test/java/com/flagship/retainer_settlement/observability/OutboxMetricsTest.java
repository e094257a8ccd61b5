package com.flagship.retainer_settlement.observability;

import com.flagship.retainer_settlement.outbox.OutboxBacklog;
import com.flagship.retainer_settlement.outbox.OutboxEventRepository;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.dao.DataAccessResourceFailureException;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class OutboxMetricsTest {

    private static final Instant NOW = Instant.parse("2024-06-01T12:00:00Z");

    private OutboxEventRepository repository;
    private SimpleMeterRegistry registry;
    private OutboxMetrics metrics;

    @BeforeEach
    void setUp() {
        repository = mock(OutboxEventRepository.class);
        registry = new SimpleMeterRegistry();
        metrics = new OutboxMetrics(repository, registry, Clock.fixed(NOW, ZoneOffset.UTC), 5);
    }

    @Test
    @DisplayName("Backlog gauges are reported per aggregate and zeroed for aggregates with nothing pending")
    void backlogPerAggregate() {
        when(repository.summarizeBacklog(5)).thenReturn(List.of(
                new OutboxBacklog("Invoice", 3L, 1L, NOW.minusSeconds(90))));

        metrics.refresh();

        assertEquals(3.0, gauge("settlement.outbox.pending", "Invoice"));
        assertEquals(1.0, gauge("settlement.outbox.exhausted", "Invoice"));
        assertEquals(90.0, gauge("settlement.outbox.lag.seconds", "Invoice"));
        assertEquals(0.0, gauge("settlement.outbox.pending", "Deal"));
    }

    @Test
    @DisplayName("A drained backlog resets the gauges")
    void drainedBacklogResets() {
        when(repository.summarizeBacklog(5))
                .thenReturn(List.of(new OutboxBacklog("Deal", 2L, 0L, NOW.minusSeconds(5))))
                .thenReturn(List.of());

        metrics.refresh();
        metrics.refresh();

        assertEquals(0.0, gauge("settlement.outbox.pending", "Deal"));
        assertEquals(0.0, gauge("settlement.outbox.lag.seconds", "Deal"));
    }

    @Test
    @DisplayName("A database error keeps the previous snapshot")
    void databaseErrorKeepsSnapshot() {
        when(repository.summarizeBacklog(5))
                .thenReturn(List.of(new OutboxBacklog("Deal", 2L, 0L, NOW)))
                .thenThrow(new DataAccessResourceFailureException("connection refused"));

        metrics.refresh();
        metrics.refresh();

        assertEquals(2.0, gauge("settlement.outbox.pending", "Deal"));
    }

    @Test
    @DisplayName("Deliveries are counted by event type and outcome")
    void deliveryCounters() {
        metrics.recordEventPublished("InvoiceCreated");
        metrics.recordEventPublished("InvoiceCreated");
        metrics.recordEventPublishFailed("DealStageChanged");

        assertEquals(2.0, registry.get("settlement.outbox.deliveries")
                .tags("event_type", "InvoiceCreated", "outcome", "delivered").counter().count());
        assertEquals(1.0, registry.get("settlement.outbox.deliveries")
                .tags("event_type", "DealStageChanged", "outcome", "failed").counter().count());
    }

    private double gauge(String name, String aggregate) {
        return registry.get(name).tag("aggregate", aggregate).gauge().value();
    }
}
