package com.example.retrain.ml;

import java.time.Duration;
import java.time.Instant;

/**
 * Result of one training run: a candidate or a failure. Nothing is persisted yet.
 */
public sealed interface TrainingOutcome permits TrainingOutcome.Candidate, TrainingOutcome.Failure {

    /** A freshly trained model not yet approved for serving. */
    record Candidate(RegressionModel model, ModelMetrics metrics, Instant trainedAt,
                     Duration took, int rows) implements TrainingOutcome {}

    record Failure(Cause cause, String message, Duration took) implements TrainingOutcome {}

    enum Cause {
        /** The fit capability threw. */
        FIT_ERROR,
        /** The fit exceeded {@code retrain.training-timeout}. */
        TIMEOUT,
        /** The fit returned no model, no metrics or non-finite coefficients. */
        DEGENERATE_OUTPUT
    }
}
