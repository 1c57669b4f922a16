package com.example.retrain.gate;

/**
 * Accept or reject, with the rule that decided and the numbers behind it.
 */
public record GateVerdict(Code code, String detail) {

    public enum Code {
        ACCEPTED(true),
        /** No usable baseline to compare against; the candidate's own metrics are valid. */
        ACCEPTED_WITHOUT_BASELINE(true),
        MISSING_METRICS(false),
        NON_FINITE_METRICS(false),
        TOO_FEW_VALIDATION_SAMPLES(false),
        REGRESSION(false);

        private final boolean accepted;

        Code(boolean accepted) { this.accepted = accepted; }
    }

    public boolean accepted() {
        return code.accepted;
    }
}
