package com.flagship.classroom_ledger.outbox;

/**
 * Aggregates that publish events through the outbox, with the property that
 * names the Kafka topic each one is routed to.
 */
public enum AggregateType {
    CLAIM("Claim"),
    LEDGER_ENTRY("LedgerEntry"),
    ENROLLMENT("Enrollment");

    private final String label;

    AggregateType(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    public static AggregateType fromLabel(String label) {
        for (AggregateType type : values()) {
            if (type.label.equals(label)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown aggregate type: " + label);
    }
}
