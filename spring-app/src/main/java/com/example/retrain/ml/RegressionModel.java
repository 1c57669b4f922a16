package com.example.retrain.ml;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.List;

/**
 * Linear regression model: {@code y = coefficients[0] + sum(coefficients[i+1] * x[i])}.
 * Serialized as-is into model artifacts.
 */
public record RegressionModel(List<String> featureNames, double[] coefficients) {

    public double predict(double[] x) {
        if (x.length + 1 != coefficients.length) {
            throw new IllegalArgumentException("Expected " + (coefficients.length - 1) + " features, got " + x.length);
        }
        double y = coefficients[0];
        for (int i = 0; i < x.length; i++) y += coefficients[i + 1] * x[i];
        return y;
    }

    @JsonIgnore
    public boolean isFinite() {
        if (coefficients == null || coefficients.length == 0) return false;
        for (double c : coefficients) if (!Double.isFinite(c)) return false;
        return true;
    }
}
