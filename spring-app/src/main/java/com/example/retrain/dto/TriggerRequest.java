package com.example.retrain.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Manual retrain request. Every field is optional.
 *
 * @param reason free-text note recorded in the ledger (default {@code "manual"})
 * @param force  bypass data sufficiency and staleness checks (default {@code false})
 * @param block  JSON {@code wait}: return the finished attempt instead of {@code "started"} (default {@code true})
 */
public record TriggerRequest(String reason, Boolean force, @JsonProperty("wait") Boolean block) {

    public String reasonOrDefault() {
        return reason == null || reason.isBlank() ? "manual" : reason.trim();
    }

    public boolean forced() {
        return Boolean.TRUE.equals(force);
    }

    public boolean waitForCompletion() {
        return block == null || block;
    }
}
