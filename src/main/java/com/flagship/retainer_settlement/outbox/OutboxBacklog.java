package com.flagship.retainer_settlement.outbox;

import java.time.Instant;

/**
 * Undelivered events of one aggregate type.
 *
 * @param aggregateType stored aggregate name
 * @param pending       events not yet published
 * @param exhausted     pending events that have used up their retries
 * @param oldest        creation time of the oldest pending event
 */
public record OutboxBacklog(String aggregateType, Long pending, Long exhausted, Instant oldest) {
}
