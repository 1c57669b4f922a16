package com.example.retrain.ml;

/** What a {@link ModelTrainer} produces: the fitted model and its hold-out metrics. */
public record FitResult(RegressionModel model, ModelMetrics metrics) {}
