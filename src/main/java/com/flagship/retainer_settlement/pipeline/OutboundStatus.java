package com.flagship.retainer_settlement.pipeline;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Money the platform owes the lead vendor ("Pay BPO").
 * Stays LOCKED until the inbound payment has been received.
 */
public enum OutboundStatus {
    LOCKED("locked"),
    PAID("paid");

    private final String value;

    OutboundStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}
