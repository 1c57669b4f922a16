package com.example.retrain.ledger;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/** Why a retrain attempt was started. */
public enum TriggerReason {
    THRESHOLD_MET("threshold-met"),
    STALE_MODEL("stale-model"),
    MANUAL("manual"),
    FORCED("forced");

    private final String label;

    TriggerReason(String label) { this.label = label; }

    @JsonValue
    public String label() { return label; }

    @JsonCreator
    public static TriggerReason fromLabel(String label) {
        for (TriggerReason r : values()) {
            if (r.label.equalsIgnoreCase(label) || r.name().equalsIgnoreCase(label)) return r;
        }
        throw new IllegalArgumentException("Unknown trigger reason: " + label);
    }
}
