package com.flagship.retainer_settlement.invoice.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.retainer_settlement.invoice.Invoice;
import com.flagship.retainer_settlement.invoice.InvoiceStatus;
import com.flagship.retainer_settlement.invoice.InvoiceType;
import com.flagship.retainer_settlement.invoice.LineItem;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

@Value
@Builder
public class InvoiceResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("invoice_number")
    String invoiceNumber;

    @JsonProperty("invoice_type")
    InvoiceType invoiceType;

    @JsonProperty("lawyer_id")
    UUID lawyerId;

    @JsonProperty("lead_vendor_id")
    UUID leadVendorId;

    @JsonProperty("created_by")
    UUID createdBy;

    @JsonProperty("date_range_start")
    LocalDate dateRangeStart;

    @JsonProperty("date_range_end")
    LocalDate dateRangeEnd;

    @JsonProperty("deal_ids")
    List<UUID> dealIds;

    @JsonProperty("items")
    List<LineItem> items;

    @JsonProperty("subtotal")
    BigDecimal subtotal;

    @JsonProperty("tax_rate")
    BigDecimal taxRate;

    @JsonProperty("tax_amount")
    BigDecimal taxAmount;

    @JsonProperty("total_amount")
    BigDecimal totalAmount;

    @JsonProperty("status")
    InvoiceStatus status;

    @JsonProperty("notes")
    String notes;

    @JsonProperty("due_date")
    LocalDate dueDate;

    @JsonProperty("created_at")
    Instant createdAt;

    @JsonProperty("updated_at")
    Instant updatedAt;

    public static InvoiceResponse from(Invoice invoice) {
        return InvoiceResponse.builder()
            .id(invoice.getId())
            .invoiceNumber(invoice.getInvoiceNumber())
            .invoiceType(invoice.getInvoiceType())
            .lawyerId(invoice.getLawyerId())
            .leadVendorId(invoice.getLeadVendorId())
            .createdBy(invoice.getCreatedBy())
            .dateRangeStart(invoice.getDateRangeStart())
            .dateRangeEnd(invoice.getDateRangeEnd())
            .dealIds(invoice.getDealIds())
            .items(invoice.getItems())
            .subtotal(invoice.getSubtotal())
            .taxRate(invoice.getTaxRate())
            .taxAmount(invoice.getTaxAmount())
            .totalAmount(invoice.getTotalAmount())
            .status(invoice.getStatus())
            .notes(invoice.getNotes())
            .dueDate(invoice.getDueDate())
            .createdAt(invoice.getCreatedAt())
            .updatedAt(invoice.getUpdatedAt())
            .build();
    }
}
