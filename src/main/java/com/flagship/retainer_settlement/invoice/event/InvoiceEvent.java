package com.flagship.retainer_settlement.invoice.event;

import java.time.Instant;
import java.util.UUID;

public interface InvoiceEvent {

    UUID getEventId();

    UUID getInvoiceId();

    Instant getOccurredAt();

    String getEventType();
}
