package com.example.retrain.dto;

/**
 * Prediction from the current model artifact.
 *
 * @param predicted_value predicted median house value (thousands USD)
 * @param model_version   artifact that produced it
 */
public record PredictionView(double predicted_value, long model_version) {}
