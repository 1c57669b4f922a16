package com.example.retrain.dto;

import com.example.retrain.ledger.RetrainAttempt;

import java.util.List;

/**
 * Snapshot of the retraining pipeline, read from durable state without waiting
 * for a running attempt.
 *
 * <ul>
 *   <li><b>model_age_days</b> – {@code null} when no model is serving.</li>
 *   <li><b>should_retrain</b> / <b>reason</b> / <b>detail</b> – automatic policy evaluation at request time.</li>
 *   <li><b>attempts_in_window</b> / <b>max_attempts</b> – rate limiter usage over the trailing window.</li>
 *   <li><b>recent_attempts</b> – newest ledger entries, oldest first.</li>
 * </ul>
 */
public record StatusView(
        long pending_count,
        Long model_age_days,
        boolean should_retrain,
        String reason,
        String detail,
        int attempts_in_window,
        int max_attempts,
        boolean attempt_in_progress,
        Long current_version,
        List<RetrainAttempt> recent_attempts) {}
