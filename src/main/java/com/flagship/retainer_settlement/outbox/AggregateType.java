package com.flagship.retainer_settlement.outbox;

/**
 * Aggregates that emit events. The name is stored in {@code outbox_events.aggregate_type}
 * and decides the Kafka topic.
 */
public enum AggregateType {
    DEAL("Deal"),
    INVOICE("Invoice");

    private final String storedName;

    AggregateType(String storedName) {
        this.storedName = storedName;
    }

    public String getStoredName() {
        return storedName;
    }

    public static AggregateType fromStoredName(String storedName) {
        for (AggregateType type : values()) {
            if (type.storedName.equals(storedName)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown aggregate type: " + storedName);
    }
}
