package com.flagship.retainer_settlement.invoice;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;

/**
 * Invoice payment status.
 *
 * PENDING -> PAID -> CHARGEBACK. CHARGEBACK is terminal.
 */
public enum InvoiceStatus {
    PENDING("pending"),
    PAID("paid"),
    CHARGEBACK("chargeback");

    private final String value;

    InvoiceStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static InvoiceStatus fromValue(String value) {
        return Arrays.stream(values())
                .filter(status -> status.value.equalsIgnoreCase(value))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown invoice status: " + value));
    }

    /**
     * Same status is allowed and treated as a no-op.
     */
    public boolean canTransitionTo(InvoiceStatus target) {
        if (this == target) {
            return true;
        }
        return switch (this) {
            case PENDING -> target == PAID;
            case PAID -> target == CHARGEBACK;
            case CHARGEBACK -> false;
        };
    }

    public boolean isTerminal() {
        return this == CHARGEBACK;
    }
}
