package com.example.retrain.ml;

/**
 * One (features, label) row handed to a {@link ModelTrainer}. Features are in
 * {@link com.example.retrain.store.FeatureDomain} order.
 */
public record TrainingRow(double[] x, double y) {}
