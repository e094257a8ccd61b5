package com.flagship.retainer_settlement.settlement;

import com.fasterxml.jackson.annotation.JsonValue;

public enum TransitionOutcome {
    /**
     * Dropped on the column the card came from; nothing was persisted.
     */
    NO_OP_SAME_COLUMN("no_op_same_column"),
    COMMITTED("committed");

    private final String value;

    TransitionOutcome(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}
