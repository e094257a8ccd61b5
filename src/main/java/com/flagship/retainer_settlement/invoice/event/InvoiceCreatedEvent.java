package com.flagship.retainer_settlement.invoice.event;

import com.flagship.retainer_settlement.invoice.Invoice;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

@Value
public class InvoiceCreatedEvent implements InvoiceEvent {
    UUID eventId;
    UUID invoiceId;
    String invoiceNumber;
    String invoiceType;
    UUID counterpartyId;
    List<UUID> dealIds;
    BigDecimal totalAmount;
    Instant occurredAt;

    public static final String EVENT_TYPE = "InvoiceCreated";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    public static InvoiceCreatedEvent fromInvoice(Invoice invoice) {
        return new InvoiceCreatedEvent(
            UUID.randomUUID(),
            invoice.getId(),
            invoice.getInvoiceNumber(),
            invoice.getInvoiceType().getValue(),
            invoice.counterpartyId(),
            invoice.getDealIds(),
            invoice.getTotalAmount(),
            Instant.now()
        );
    }
}
