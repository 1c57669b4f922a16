package com.example.retrain.lifecycle;

import com.example.retrain.dto.HousingFeatures;

import java.util.Locale;

/**
 * Smoke prediction on a fixed, typical block group. Passes when the prediction is
 * finite and inside {@code (0, 2 x max-label]}.
 */
public class CanaryHealthCheck implements HealthCheck {

    public static final HousingFeatures CANARY =
            new HousingFeatures(8.33, 41.0, 6.98, 1.02, 322.0, 2.56, 37.88, -122.23);

    private final double upperBound;

    public CanaryHealthCheck(double maxLabel) {
        this.upperBound = 2 * maxLabel;
    }

    @Override
    public HealthReport check(ModelArtifact current) {
        double y;
        try {
            y = current.model().predict(CANARY.toVector());
        } catch (RuntimeException e) {
            return HealthReport.failed("canary prediction threw " + e);
        }
        String d = String.format(Locale.ROOT, "canary prediction %.2f for v%d", y, current.version());
        return Double.isFinite(y) && y > 0.0 && y <= upperBound
                ? HealthReport.ok(d)
                : HealthReport.failed(d + " outside (0, " + upperBound + "]");
    }
}
