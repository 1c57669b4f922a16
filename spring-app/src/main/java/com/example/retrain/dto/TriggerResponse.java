package com.example.retrain.dto;

import com.example.retrain.ledger.RetrainAttempt;
import com.example.retrain.ml.ModelMetrics;
import com.example.retrain.policy.TriggerDecision;

/**
 * Outcome of a trigger request.
 * <p>
 * {@code outcome} is an attempt outcome label ({@code "success"}, {@code "rejected-by-gate"},
 * {@code "training-failed"}, {@code "promotion-failed"}, {@code "rate-limited"},
 * {@code "insufficient-data"}), or {@code "started"} for an attempt left running in the
 * background, or {@code "already-in-progress"} when another attempt holds the pipeline.
 */
public record TriggerResponse(
        String outcome,
        String attempt_id,
        String reason,
        String detail,
        Long promoted_version,
        ModelMetrics candidate_metrics,
        ModelMetrics baseline_metrics) {

    public static final String STARTED = "started";
    public static final String ALREADY_IN_PROGRESS = "already-in-progress";

    public static TriggerResponse of(RetrainAttempt a) {
        return new TriggerResponse(a.outcome().label(), a.id(), a.reason().label(), a.detail(),
                a.promotedVersion(), a.candidateMetrics(), a.baselineMetrics());
    }

    public static TriggerResponse started(String attemptId, String reason, String detail) {
        return new TriggerResponse(STARTED, attemptId, reason, detail, null, null, null);
    }

    public static TriggerResponse suppressed(TriggerDecision d) {
        return new TriggerResponse(d.suppression().label(), null, d.reason(), d.detail(), null, null, null);
    }

    public static TriggerResponse alreadyInProgress() {
        return new TriggerResponse(ALREADY_IN_PROGRESS, null, null, "attempt already in progress", null, null, null);
    }
}
