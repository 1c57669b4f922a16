package com.example.retrain.ledger;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/** Final result of a retrain attempt as written to the ledger. */
public enum AttemptOutcome {
    SUCCESS("success"),
    REJECTED_BY_GATE("rejected-by-gate"),
    INSUFFICIENT_DATA("insufficient-data"),
    RATE_LIMITED("rate-limited"),
    TRAINING_FAILED("training-failed"),
    PROMOTION_FAILED("promotion-failed");

    private final String label;

    AttemptOutcome(String label) { this.label = label; }

    @JsonValue
    public String label() { return label; }

    /** Suppressed decisions never ran and do not consume the daily attempt budget. */
    public boolean executed() {
        return this != INSUFFICIENT_DATA && this != RATE_LIMITED;
    }

    @JsonCreator
    public static AttemptOutcome fromLabel(String label) {
        for (AttemptOutcome o : values()) {
            if (o.label.equalsIgnoreCase(label) || o.name().equalsIgnoreCase(label)) return o;
        }
        throw new IllegalArgumentException("Unknown attempt outcome: " + label);
    }
}
