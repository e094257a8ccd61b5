package com.flagship.retainer_settlement.invoice;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

/**
 * Invoice contents as authored, before validation and totals.
 *
 * The counterparty is {@code lawyerId} for lawyer invoices and {@code leadVendorId}
 * (a center) for publisher invoices.
 */
@Value
@Builder
public class InvoiceForm {
    InvoiceType invoiceType;
    UUID lawyerId;
    UUID leadVendorId;
    LocalDate dateRangeStart;
    LocalDate dateRangeEnd;
    LocalDate dueDate;
    @Singular
    List<UUID> dealIds;
    @Singular
    List<LineItem> items;
    BigDecimal taxRate;
    String notes;

    public UUID counterpartyId() {
        if (invoiceType == null) {
            return null;
        }
        return invoiceType == InvoiceType.LAWYER ? lawyerId : leadVendorId;
    }
}
