package com.flagship.retainer_settlement.invoice;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;

/**
 * Who an invoice bills. Each type links deals through its own column on the deal flow,
 * so a deal can carry one lawyer invoice and one publisher invoice at the same time.
 */
public enum InvoiceType {
    LAWYER("lawyer", "invoice_id"),
    PUBLISHER("publisher", "publisher_invoice_id");

    private final String value;
    private final String linkColumn;

    InvoiceType(String value, String linkColumn) {
        this.value = value;
        this.linkColumn = linkColumn;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public String getLinkColumn() {
        return linkColumn;
    }

    @JsonCreator
    public static InvoiceType fromValue(String value) {
        return Arrays.stream(values())
                .filter(type -> type.value.equalsIgnoreCase(value))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown invoice type: " + value));
    }
}
