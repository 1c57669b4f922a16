package com.example.retrain.ml;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Hold-out evaluation of a trained model.
 *
 * @param rmse           root mean squared error, the primary regression metric
 * @param mae            mean absolute error
 * @param r2             coefficient of determination
 * @param trainingSize   rows the model was fitted on
 * @param validationSize rows the metrics were computed over
 */
public record ModelMetrics(
        double rmse,
        double mae,
        double r2,
        @JsonProperty("training_size") int trainingSize,
        @JsonProperty("validation_size") int validationSize) {

    @JsonIgnore
    public boolean isFinite() {
        return Double.isFinite(rmse) && Double.isFinite(mae) && Double.isFinite(r2);
    }
}
