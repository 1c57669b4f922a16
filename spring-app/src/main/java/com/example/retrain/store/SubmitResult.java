package com.example.retrain.store;

import java.util.List;

/**
 * Outcome of submitting one sample: either the stored sample or the reasons it was rejected.
 */
public record SubmitResult(TrainingSample sample, List<String> violations) {

    public static SubmitResult accepted(TrainingSample sample) {
        return new SubmitResult(sample, List.of());
    }

    public static SubmitResult rejected(List<String> violations) {
        return new SubmitResult(null, List.copyOf(violations));
    }

    public boolean isAccepted() {
        return sample != null;
    }
}
