package com.example.retrain.ledger;

import com.example.retrain.ml.ModelMetrics;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;

import java.time.Instant;

/**
 * One ledger entry. Appended once, when the attempt finishes; never mutated.
 *
 * @param id               attempt identifier
 * @param startedAt        decision time; the rate limiter counts on this
 * @param finishedAt       time the outcome was known
 * @param reason           why the attempt was started
 * @param outcome          final result
 * @param detail           human-readable explanation (gate comparison, failure cause, ...)
 * @param candidateMetrics metrics of the trained candidate, if training produced one
 * @param baselineMetrics  metrics of the artifact serving when the candidate was judged
 * @param samplesUsed      pending samples included in the training set
 * @param promotedVersion  version made current, only on success
 * @param durationMs       wall-clock time from start to finish
 */
@Builder
public record RetrainAttempt(
        String id,
        @JsonProperty("started_at") Instant startedAt,
        @JsonProperty("finished_at") Instant finishedAt,
        TriggerReason reason,
        AttemptOutcome outcome,
        String detail,
        @JsonProperty("candidate_metrics") ModelMetrics candidateMetrics,
        @JsonProperty("baseline_metrics") ModelMetrics baselineMetrics,
        @JsonProperty("samples_used") int samplesUsed,
        @JsonProperty("promoted_version") Long promotedVersion,
        @JsonProperty("duration_ms") long durationMs) {}
