package com.example.retrain.store;

import java.util.List;

/**
 * Pending samples handed to one training attempt. {@code throughSeq} is the
 * watermark to commit if that attempt succeeds.
 */
public record PendingSnapshot(List<TrainingSample> samples, long throughSeq) {

    public PendingSnapshot {
        samples = List.copyOf(samples);
    }

    public int size() {
        return samples.size();
    }
}
