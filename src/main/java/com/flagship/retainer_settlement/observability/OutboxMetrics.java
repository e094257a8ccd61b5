package com.flagship.retainer_settlement.observability;

import com.flagship.retainer_settlement.outbox.AggregateType;
import com.flagship.retainer_settlement.outbox.OutboxBacklog;
import com.flagship.retainer_settlement.outbox.OutboxEventRepository;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataAccessException;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Delivery counters and per-aggregate backlog gauges for the outbox.
 *
 * Gauges ({@code settlement.outbox.pending}, {@code .exhausted}, {@code .lag.seconds}) are
 * tagged {@code aggregate=Deal|Invoice} and read a snapshot refreshed on a fixed rate, so a
 * scrape never hits the database.
 */
@Component
@Slf4j
public class OutboxMetrics {

    private final OutboxEventRepository repository;
    private final MeterRegistry registry;
    private final Clock clock;
    private final int maxRetries;

    private final Map<AggregateType, Snapshot> snapshots = new EnumMap<>(AggregateType.class);

    public OutboxMetrics(OutboxEventRepository repository,
                         MeterRegistry registry,
                         Clock clock,
                         @Value("${outbox.publisher.max-retries:5}") int maxRetries) {
        this.repository = repository;
        this.registry = registry;
        this.clock = clock;
        this.maxRetries = maxRetries;
        for (AggregateType type : AggregateType.values()) {
            Snapshot snapshot = new Snapshot();
            snapshots.put(type, snapshot);
            gauge("settlement.outbox.pending", "Events not yet published", type, snapshot.pending);
            gauge("settlement.outbox.exhausted", "Unpublished events with no retries left", type, snapshot.exhausted);
            gauge("settlement.outbox.lag.seconds", "Age of the oldest unpublished event", type, snapshot.lagSeconds);
        }
    }

    @Scheduled(fixedRateString = "${metrics.refresh.interval:15000}")
    public void refresh() {
        List<OutboxBacklog> backlog;
        try {
            backlog = repository.summarizeBacklog(maxRetries);
        } catch (DataAccessException e) {
            log.warn("Outbox backlog not refreshed: {}", e.getMessage());
            return;
        }
        snapshots.values().forEach(Snapshot::reset);
        for (OutboxBacklog row : backlog) {
            Snapshot snapshot = snapshots.get(AggregateType.fromStoredName(row.aggregateType()));
            snapshot.pending.set(row.pending());
            snapshot.exhausted.set(row.exhausted() == null ? 0 : row.exhausted());
            if (row.oldest() != null) {
                snapshot.lagSeconds.set(Math.max(0, Duration.between(row.oldest(), clock.instant()).toSeconds()));
            }
        }
    }

    public void recordEventPublished(String eventType) {
        delivery(eventType, "delivered").increment();
    }

    public void recordEventPublishFailed(String eventType) {
        delivery(eventType, "failed").increment();
    }

    private Counter delivery(String eventType, String outcome) {
        return Counter.builder("settlement.outbox.deliveries")
                .tag("event_type", eventType)
                .tag("outcome", outcome)
                .register(registry);
    }

    private void gauge(String name, String description, AggregateType type, AtomicLong value) {
        Gauge.builder(name, value, AtomicLong::get)
                .description(description)
                .tag("aggregate", type.getStoredName())
                .register(registry);
    }

    private static final class Snapshot {
        final AtomicLong pending = new AtomicLong();
        final AtomicLong exhausted = new AtomicLong();
        final AtomicLong lagSeconds = new AtomicLong();

        void reset() {
            pending.set(0);
            exhausted.set(0);
            lagSeconds.set(0);
        }
    }
}
