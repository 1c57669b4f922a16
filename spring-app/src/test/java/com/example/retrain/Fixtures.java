package com.example.retrain;

import com.example.retrain.dto.HousingFeatures;
import com.example.retrain.dto.SampleRequest;
import com.example.retrain.ml.FitResult;
import com.example.retrain.ml.ModelMetrics;
import com.example.retrain.ml.RegressionModel;
import com.example.retrain.ml.TrainingRow;
import com.example.retrain.store.FeatureDomain;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Random;

/** Shared test data. */
public final class Fixtures {

    public static final Instant T0 = Instant.parse("2026-03-02T09:00:00Z");

    private Fixtures() {}

    public static HousingFeatures validFeatures() {
        return new HousingFeatures(8.33, 41.0, 6.98, 1.02, 322.0, 2.56, 37.88, -122.23);
    }

    public static SampleRequest validSample(int i) {
        HousingFeatures f = new HousingFeatures(
                1.0 + (i % 10), 5.0 + (i % 40), 4.0 + (i % 5), 1.0, 500.0 + i, 2.5, 34.0 + (i % 6), -118.0 - (i % 4));
        return new SampleRequest(f, 100.0 + (i % 300));
    }

    public static SampleRequest outOfRangeSample() {
        return new SampleRequest(new HousingFeatures(8.33, 41.0, 6.98, 1.02, 322.0, 2.56, 45.0, -122.23), 200.0);
    }

    /** Rows from a known linear relation with light noise. */
    public static List<TrainingRow> syntheticRows(int n, long seed) {
        Random rnd = new Random(seed);
        List<TrainingRow> rows = new ArrayList<>(n);
        for (int i = 0; i < n; i++) {
            double[] x = new double[FeatureDomain.values().length];
            for (int j = 0; j < x.length; j++) {
                FeatureDomain d = FeatureDomain.values()[j];
                x[j] = d.min() + rnd.nextDouble() * (d.max() - d.min());
            }
            double y = 60 + 30 * x[0] + 0.8 * x[1] - 2 * x[6] - 1.5 * x[7] + rnd.nextGaussian() * 5;
            rows.add(new TrainingRow(x, y));
        }
        return rows;
    }

    /** Constant model predicting {@code value} for every input. */
    public static RegressionModel constantModel(double value) {
        double[] c = new double[FeatureDomain.values().length + 1];
        c[0] = value;
        return new RegressionModel(Arrays.asList(FeatureDomain.columns()), c);
    }

    public static ModelMetrics metrics(double rmse) {
        return new ModelMetrics(rmse, rmse * 0.8, 0.6, 200, 50);
    }

    public static FitResult fit(double rmse) {
        return new FitResult(constantModel(200.0), metrics(rmse));
    }

    /** Clock the test moves by hand. */
    public static final class MutableClock extends Clock {
        private volatile Instant now;

        public MutableClock(Instant start) { this.now = start; }

        public void advance(Duration d) { now = now.plus(d); }

        @Override public ZoneId getZone() { return ZoneOffset.UTC; }
        @Override public Clock withZone(ZoneId zone) { return this; }
        @Override public Instant instant() { return now; }
    }
}
