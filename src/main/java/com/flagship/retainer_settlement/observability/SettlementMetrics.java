package com.flagship.retainer_settlement.observability;

import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Metrics for the settlement pipeline and invoicing.
 *
 * <ul>
 *   <li>settlement.transitions{outcome, target_stage}: kanban moves by outcome</li>
 *   <li>settlement.safety_lock.rejections: pay-outbound attempts blocked by the safety lock</li>
 *   <li>settlement.inbound.received: inbound payments marked received</li>
 *   <li>settlement.persistence.latency{operation}: time spent in the store per operation</li>
 *   <li>invoices.created{type}, invoices.status_changed{status}</li>
 *   <li>invoices.deal_links{result}: link operations that were complete, partial or empty</li>
 *   <li>idempotency.cache{result}</li>
 * </ul>
 */
@Component
public class SettlementMetrics {

    private final MeterRegistry registry;

    public SettlementMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordTransition(String outcome, String targetStageKey) {
        registry.counter("settlement.transitions",
                "outcome", sanitizeTag(outcome),
                "target_stage", sanitizeTag(targetStageKey)
        ).increment();
    }

    public void recordSafetyLockRejection() {
        registry.counter("settlement.safety_lock.rejections").increment();
    }

    public void recordInboundReceived() {
        registry.counter("settlement.inbound.received").increment();
    }

    public void recordPersistenceLatency(String operation, long durationMs) {
        registry.timer("settlement.persistence.latency",
                "operation", sanitizeTag(operation)
        ).record(Duration.ofMillis(durationMs));
    }

    public void recordInvoiceCreated(String invoiceType) {
        registry.counter("invoices.created", "type", sanitizeTag(invoiceType)).increment();
    }

    public void recordInvoiceStatusChanged(String status) {
        registry.counter("invoices.status_changed", "status", sanitizeTag(status)).increment();
    }

    public void recordDealLink(String result) {
        registry.counter("invoices.deal_links", "result", sanitizeTag(result)).increment();
    }

    public void recordIdempotencyHit() {
        registry.counter("idempotency.cache", "result", "hit").increment();
    }

    public void recordIdempotencyMiss() {
        registry.counter("idempotency.cache", "result", "miss").increment();
    }

    /**
     * Keeps tag cardinality bounded.
     */
    private String sanitizeTag(String value) {
        if (value == null) {
            return "unknown";
        }
        String sanitized = value.replaceAll("[^a-zA-Z0-9_]", "_");
        return sanitized.length() > 50 ? sanitized.substring(0, 50) : sanitized;
    }
}
