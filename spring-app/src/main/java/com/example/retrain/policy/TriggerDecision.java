package com.example.retrain.policy;

import com.example.retrain.ledger.AttemptOutcome;
import com.example.retrain.ledger.TriggerReason;

/**
 * Result of one policy evaluation.
 *
 * @param cause            the rule that decided
 * @param detail           numbers behind the decision
 * @param attemptsInWindow executed attempts inside the rate window at {@code now}
 * @param modelAgeDays     whole days since the current artifact was trained, {@code null} without one
 */
public record TriggerDecision(Cause cause, String detail, int attemptsInWindow, Long modelAgeDays) {

    public enum Cause {
        THRESHOLD_MET("threshold met", TriggerReason.THRESHOLD_MET, null),
        STALE_MODEL("stale model", TriggerReason.STALE_MODEL, null),
        MANUAL("manual", TriggerReason.MANUAL, null),
        FORCED("forced", TriggerReason.FORCED, null),
        RATE_LIMITED("rate limited", null, AttemptOutcome.RATE_LIMITED),
        INSUFFICIENT_DATA("insufficient data", null, AttemptOutcome.INSUFFICIENT_DATA);

        private final String label;
        private final TriggerReason reason;
        private final AttemptOutcome suppression;

        Cause(String label, TriggerReason reason, AttemptOutcome suppression) {
            this.label = label;
            this.reason = reason;
            this.suppression = suppression;
        }

        public String label() { return label; }
    }

    public boolean shouldRetrain() {
        return cause.reason != null;
    }

    /** Short human-readable reason, e.g. {@code "threshold met"}. */
    public String reason() {
        return cause.label;
    }

    /** Ledger reason for a positive decision, {@code null} otherwise. */
    public TriggerReason triggerReason() {
        return cause.reason;
    }

    /** Ledger outcome for a negative decision, {@code null} otherwise. */
    public AttemptOutcome suppression() {
        return cause.suppression;
    }
}
