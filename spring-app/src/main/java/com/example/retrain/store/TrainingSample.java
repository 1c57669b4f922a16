package com.example.retrain.store;

import com.example.retrain.dto.HousingFeatures;
import com.example.retrain.ml.TrainingRow;

import java.time.Instant;

/**
 * An accepted, durably stored observation. Never mutated.
 *
 * @param seq        store-assigned sequence number, contiguous from 1
 * @param features   validated features
 * @param label      ground-truth target
 * @param receivedAt acceptance time
 */
public record TrainingSample(long seq, HousingFeatures features, double label, Instant receivedAt) {

    public TrainingRow toRow() {
        return new TrainingRow(features.toVector(), label);
    }
}
