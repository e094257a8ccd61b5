package com.flagship.retainer_settlement.invoice;

import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

/**
 * An issued invoice.
 *
 * Status changes return a new instance and are validated against {@link InvoiceStatus#canTransitionTo}.
 * Contents can only be revised while the invoice is still pending.
 */
@Value
public class Invoice {
    UUID id;
    String invoiceNumber;
    InvoiceType invoiceType;
    UUID lawyerId;
    UUID leadVendorId;
    UUID createdBy;
    LocalDate dateRangeStart;
    LocalDate dateRangeEnd;
    List<UUID> dealIds;
    List<LineItem> items;
    BigDecimal subtotal;
    BigDecimal taxRate;
    BigDecimal taxAmount;
    BigDecimal totalAmount;
    InvoiceStatus status;
    String notes;
    LocalDate dueDate;
    Instant createdAt;
    Instant updatedAt;

    /**
     * A new pending invoice. {@code items} must already be validated and {@code totals} computed from them.
     */
    public static Invoice create(UUID id, String invoiceNumber, InvoiceForm form, List<LineItem> items,
                                 InvoiceTotals totals, UUID createdBy, Instant now) {
        return new Invoice(
            id,
            invoiceNumber,
            form.getInvoiceType(),
            form.getInvoiceType() == InvoiceType.LAWYER ? form.getLawyerId() : null,
            form.getInvoiceType() == InvoiceType.PUBLISHER ? form.getLeadVendorId() : null,
            createdBy,
            form.getDateRangeStart(),
            form.getDateRangeEnd(),
            List.copyOf(form.getDealIds()),
            List.copyOf(items),
            totals.getSubtotal(),
            form.getTaxRate(),
            totals.getTaxAmount(),
            totals.getTotalAmount(),
            InvoiceStatus.PENDING,
            form.getNotes(),
            form.getDueDate(),
            now,
            now
        );
    }

    /**
     * Replaces the authored contents. Number, type, creator and status are kept.
     *
     * @throws InvoiceStateException if the invoice is no longer pending
     */
    public Invoice revise(InvoiceForm form, List<LineItem> items, InvoiceTotals totals, Instant now) {
        if (status != InvoiceStatus.PENDING) {
            throw new InvoiceStateException(String.format(
                "Invoice %s is %s and can no longer be edited", invoiceNumber, status.getValue()));
        }
        if (form.getInvoiceType() != invoiceType) {
            throw new IllegalArgumentException("Invoice type cannot be changed");
        }
        return new Invoice(
            id,
            invoiceNumber,
            invoiceType,
            invoiceType == InvoiceType.LAWYER ? form.getLawyerId() : null,
            invoiceType == InvoiceType.PUBLISHER ? form.getLeadVendorId() : null,
            createdBy,
            form.getDateRangeStart(),
            form.getDateRangeEnd(),
            List.copyOf(form.getDealIds()),
            List.copyOf(items),
            totals.getSubtotal(),
            form.getTaxRate(),
            totals.getTaxAmount(),
            totals.getTotalAmount(),
            status,
            form.getNotes(),
            form.getDueDate(),
            createdAt,
            now
        );
    }

    /**
     * @throws InvoiceStateException if {@code target} is not reachable from the current status
     */
    public Invoice transitionTo(InvoiceStatus target, Instant now) {
        if (!status.canTransitionTo(target)) {
            throw new InvoiceStateException(String.format(
                "Cannot move invoice %s from %s to %s", invoiceNumber, status.getValue(), target.getValue()));
        }
        if (status == target) {
            return this;
        }
        return new Invoice(
            id,
            invoiceNumber,
            invoiceType,
            lawyerId,
            leadVendorId,
            createdBy,
            dateRangeStart,
            dateRangeEnd,
            dealIds,
            items,
            subtotal,
            taxRate,
            taxAmount,
            totalAmount,
            target,
            notes,
            dueDate,
            createdAt,
            now
        );
    }

    public UUID counterpartyId() {
        return invoiceType == InvoiceType.LAWYER ? lawyerId : leadVendorId;
    }
}
