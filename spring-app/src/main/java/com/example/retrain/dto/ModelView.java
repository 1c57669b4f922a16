package com.example.retrain.dto;

import com.example.retrain.ml.ModelMetrics;

import java.time.Instant;
import java.util.List;

/** Current artifact metadata plus the retained backup versions (oldest first). */
public record ModelView(
        long version,
        Instant trained_at,
        long age_days,
        ModelMetrics metrics,
        double[] coefficients,
        List<Long> backup_versions) {}
