package com.example.retrain.ml;

import java.util.List;

/**
 * Pluggable fit capability: {@code fit(data) -> model, metrics}.
 * <p>
 * Implementations may throw any exception; the orchestrator reports it as a training failure.
 * They must not write anything the model lifecycle can see.
 */
@FunctionalInterface
public interface ModelTrainer {

    FitResult fit(List<TrainingRow> rows);
}
