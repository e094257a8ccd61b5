package com.flagship.retainer_settlement.invoice.event;

import com.flagship.retainer_settlement.invoice.Invoice;
import com.flagship.retainer_settlement.invoice.InvoiceStatus;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * An invoice was paid or charged back.
 */
@Value
public class InvoiceStatusChangedEvent implements InvoiceEvent {
    UUID eventId;
    UUID invoiceId;
    String invoiceNumber;
    String previousStatus;
    String newStatus;
    Instant occurredAt;

    public static final String EVENT_TYPE = "InvoiceStatusChanged";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    public static InvoiceStatusChangedEvent of(Invoice invoice, InvoiceStatus previousStatus) {
        return new InvoiceStatusChangedEvent(
            UUID.randomUUID(),
            invoice.getId(),
            invoice.getInvoiceNumber(),
            previousStatus.getValue(),
            invoice.getStatus().getValue(),
            Instant.now()
        );
    }
}
