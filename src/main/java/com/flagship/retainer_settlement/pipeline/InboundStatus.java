package com.flagship.retainer_settlement.pipeline;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Money owed to the platform by the attorney.
 */
public enum InboundStatus {
    PENDING("pending"),
    RECEIVED("received");

    private final String value;

    InboundStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}
