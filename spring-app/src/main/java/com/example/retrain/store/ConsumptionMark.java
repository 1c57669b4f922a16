package com.example.retrain.store;

import java.time.Instant;

/**
 * Durable watermark: every sample with {@code seq <= throughSeq} was consumed
 * by the successful attempt {@code attemptId}.
 */
public record ConsumptionMark(long throughSeq, Instant consumedAt, String attemptId) {}
