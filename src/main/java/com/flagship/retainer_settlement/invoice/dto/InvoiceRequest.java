package com.flagship.retainer_settlement.invoice.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.retainer_settlement.invoice.InvoiceForm;
import com.flagship.retainer_settlement.invoice.InvoiceType;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

/**
 * Body of invoice create and edit requests.
 */
@Value
public class InvoiceRequest {

    @NotNull(message = "Invoice type is required")
    @JsonProperty("invoice_type")
    InvoiceType invoiceType;

    @JsonProperty("lawyer_id")
    UUID lawyerId;

    @JsonProperty("lead_vendor_id")
    UUID leadVendorId;

    @JsonProperty("date_range_start")
    LocalDate dateRangeStart;

    @JsonProperty("date_range_end")
    LocalDate dateRangeEnd;

    @JsonProperty("due_date")
    LocalDate dueDate;

    @JsonProperty("deal_ids")
    List<UUID> dealIds;

    @Valid
    @JsonProperty("items")
    List<LineItemRequest> items;

    @DecimalMin(value = "0", message = "Tax rate cannot be negative")
    @DecimalMax(value = "1", message = "Tax rate cannot exceed 1")
    @JsonProperty("tax_rate")
    BigDecimal taxRate;

    @Size(max = 4000, message = "Notes are limited to 4000 characters")
    @JsonProperty("notes")
    String notes;

    public InvoiceForm toForm() {
        return InvoiceForm.builder()
            .invoiceType(invoiceType)
            .lawyerId(lawyerId)
            .leadVendorId(leadVendorId)
            .dateRangeStart(dateRangeStart)
            .dateRangeEnd(dateRangeEnd)
            .dueDate(dueDate)
            .dealIds(dealIds == null ? List.of() : dealIds)
            .items(items == null ? List.of() : items.stream().map(LineItemRequest::toLineItem).toList())
            .taxRate(taxRate == null ? BigDecimal.ZERO : taxRate)
            .notes(notes)
            .build();
    }
}
