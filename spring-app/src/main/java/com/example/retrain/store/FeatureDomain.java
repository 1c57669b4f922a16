package com.example.retrain.store;

import com.example.retrain.dto.HousingFeatures;

import java.util.function.Function;

/**
 * Declared domain of every model feature, in model input order.
 * Bounds are inclusive.
 */
public enum FeatureDomain {

    MED_INC("MedInc", 0.5, 15.0, HousingFeatures::medInc),
    HOUSE_AGE("HouseAge", 1, 52, HousingFeatures::houseAge),
    AVE_ROOMS("AveRooms", 2.0, 15.0, HousingFeatures::aveRooms),
    AVE_BEDRMS("AveBedrms", 0.1, 5.0, HousingFeatures::aveBedrms),
    POPULATION("Population", 3, 40000, HousingFeatures::population),
    AVE_OCCUP("AveOccup", 1.0, 50.0, HousingFeatures::aveOccup),
    LATITUDE("Latitude", 32.5, 41.95, HousingFeatures::latitude),
    LONGITUDE("Longitude", -124.35, -114.13, HousingFeatures::longitude);

    private final String column;
    private final double min;
    private final double max;
    private final Function<HousingFeatures, Double> accessor;

    FeatureDomain(String column, double min, double max, Function<HousingFeatures, Double> accessor) {
        this.column = column;
        this.min = min;
        this.max = max;
        this.accessor = accessor;
    }

    public String column() { return column; }
    public double min() { return min; }
    public double max() { return max; }

    /** Raw value of this feature, {@code null} when absent. */
    public Double valueOf(HousingFeatures f) {
        return accessor.apply(f);
    }

    public boolean contains(double v) {
        return Double.isFinite(v) && v >= min && v <= max;
    }

    public static String[] columns() {
        FeatureDomain[] all = values();
        String[] out = new String[all.length];
        for (int i = 0; i < all.length; i++) out[i] = all[i].column;
        return out;
    }
}
