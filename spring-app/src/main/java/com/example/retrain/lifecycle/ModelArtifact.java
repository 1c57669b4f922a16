package com.example.retrain.lifecycle;

import com.example.retrain.ml.ModelMetrics;
import com.example.retrain.ml.RegressionModel;

import java.time.Duration;
import java.time.Instant;

/**
 * A trained, versioned, servable model. Immutable once stored.
 *
 * @param version         monotonically increasing, assigned at promotion
 * @param trainedAt       training completion time; model age is measured from it
 * @param metrics         hold-out metrics, the baseline for the next candidate
 * @param storageLocation where the artifact is stored, filled in by the {@link ArtifactStore}
 * @param model           the fitted model
 */
public record ModelArtifact(
        long version,
        Instant trainedAt,
        ModelMetrics metrics,
        String storageLocation,
        RegressionModel model) {

    public ModelArtifact withStorageLocation(String location) {
        return new ModelArtifact(version, trainedAt, metrics, location, model);
    }

    public long ageDays(Instant now) {
        return ageDays(trainedAt, now);
    }

    /** Whole days from {@code trainedAt} to {@code now}, never negative. */
    public static long ageDays(Instant trainedAt, Instant now) {
        return Math.max(0L, Duration.between(trainedAt, now).toDays());
    }
}
