package com.example.retrain.lifecycle;

import com.fasterxml.jackson.annotation.JsonProperty;

public record RollbackResult(
        @JsonProperty("rolled_back") boolean rolledBack,
        @JsonProperty("from_version") Long fromVersion,
        @JsonProperty("to_version") Long toVersion,
        String detail) {}
