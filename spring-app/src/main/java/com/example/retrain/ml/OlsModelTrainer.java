package com.example.retrain.ml;

import com.example.retrain.store.FeatureDomain;
import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.ArrayRealVector;
import org.apache.commons.math3.linear.QRDecomposition;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.RealVector;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Random;

/**
 * Ordinary least squares via QR decomposition, evaluated on a seeded hold-out split.
 * <p>
 * The same rows and seed always give the same split and coefficients. The fit gives up
 * between steps once its thread is interrupted.
 */
public class OlsModelTrainer implements ModelTrainer {

    private final double holdoutFraction;
    private final long seed;

    public OlsModelTrainer(double holdoutFraction, long seed) {
        if (holdoutFraction <= 0.0 || holdoutFraction >= 1.0) {
            throw new IllegalArgumentException("holdoutFraction must be in (0, 1): " + holdoutFraction);
        }
        this.holdoutFraction = holdoutFraction;
        this.seed = seed;
    }

    @Override
    public FitResult fit(List<TrainingRow> rows) {
        int n = rows.size();
        int p = FeatureDomain.values().length + 1;
        int holdout = (int) Math.round(n * holdoutFraction);
        if (holdout < 1 || n - holdout < p) {
            throw new IllegalArgumentException("Not enough rows to fit and evaluate: " + n);
        }

        List<Integer> idx = new ArrayList<>(n);
        for (int i = 0; i < n; i++) idx.add(i);
        Collections.shuffle(idx, new Random(seed));
        List<TrainingRow> test = new ArrayList<>(holdout);
        List<TrainingRow> train = new ArrayList<>(n - holdout);
        for (int i = 0; i < n; i++) (i < holdout ? test : train).add(rows.get(idx.get(i)));

        checkInterrupted();
        double[] beta = solve(train, p);
        checkInterrupted();
        RegressionModel model = new RegressionModel(Arrays.asList(FeatureDomain.columns()), beta);
        return new FitResult(model, evaluate(model, test, train.size()));
    }

    private static void checkInterrupted() {
        if (Thread.currentThread().isInterrupted()) {
            throw new IllegalStateException("Fit interrupted");
        }
    }

    private static double[] solve(List<TrainingRow> train, int p) {
        int n = train.size();
        double[][] xa = new double[n][p];
        double[] ya = new double[n];
        for (int i = 0; i < n; i++) {
            TrainingRow r = train.get(i);
            if (r.x().length != p - 1) {
                throw new IllegalArgumentException("Row " + i + " has " + r.x().length + " features");
            }
            xa[i][0] = 1.0;
            System.arraycopy(r.x(), 0, xa[i], 1, r.x().length);
            ya[i] = r.y();
        }
        RealMatrix xm = new Array2DRowRealMatrix(xa, false);
        RealVector yv = new ArrayRealVector(ya, false);
        return new QRDecomposition(xm).getSolver().solve(yv).toArray();
    }

    private static ModelMetrics evaluate(RegressionModel model, List<TrainingRow> test, int trainingSize) {
        double sse = 0, sae = 0, mean = 0;
        for (TrainingRow r : test) mean += r.y();
        mean /= test.size();
        double sst = 0;
        for (TrainingRow r : test) {
            double err = model.predict(r.x()) - r.y();
            sse += err * err;
            sae += Math.abs(err);
            sst += (r.y() - mean) * (r.y() - mean);
        }
        double rmse = Math.sqrt(sse / test.size());
        double r2 = sst == 0 ? 0.0 : 1.0 - sse / sst;
        return new ModelMetrics(rmse, sae / test.size(), r2, trainingSize, test.size());
    }
}
