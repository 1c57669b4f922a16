package com.example.retrain.store;

import com.example.retrain.dto.HousingFeatures;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Checks a sample against the declared {@link FeatureDomain} ranges, the
 * bedrooms/rooms business rule and label plausibility.
 * <p>
 * Stateless and thread-safe.
 */
public class SampleValidator {

    private final double maxLabel;

    public SampleValidator(double maxLabel) {
        this.maxLabel = maxLabel;
    }

    /** @return every violation found, empty when the sample may be stored */
    public List<String> violations(HousingFeatures features, Double label) {
        List<String> out = new ArrayList<>();
        if (features == null) {
            out.add("features: required");
        } else {
            for (FeatureDomain d : FeatureDomain.values()) {
                Double v = d.valueOf(features);
                if (v == null) {
                    out.add(d.column() + ": required");
                } else if (!d.contains(v)) {
                    out.add(String.format(Locale.ROOT, "%s: %s outside [%s, %s]",
                            d.column(), v, d.min(), d.max()));
                }
            }
            if (features.aveBedrms() != null && features.aveRooms() != null
                    && features.aveBedrms() > features.aveRooms()) {
                out.add("AveBedrms: average bedrooms cannot exceed average rooms");
            }
        }
        if (label == null) {
            out.add("label: required");
        } else if (!Double.isFinite(label) || label <= 0.0 || label > maxLabel) {
            out.add(String.format(Locale.ROOT, "label: %s outside (0, %s]", label, maxLabel));
        }
        return out;
    }
}
