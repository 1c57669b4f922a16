package com.example.retrain.dto;

/**
 * Result of a single accepted submission.
 *
 * @param accepted       always {@code true}; rejections are reported as validation errors
 * @param total_pending  samples waiting for the next successful retrain, including this one
 * @param should_retrain what the trigger policy says right now
 * @param reason         the policy's short reason, e.g. {@code "threshold met"}
 */
public record SubmitResponse(
        boolean accepted,
        long total_pending,
        boolean should_retrain,
        String reason) {}
