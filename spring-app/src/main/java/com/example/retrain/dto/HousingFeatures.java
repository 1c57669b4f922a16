package com.example.retrain.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Immutable Data Transfer Object (DTO) describing one census block group,
 * the input of the housing price regression model.
 *
 * <p>
 * Components are boxed so that a field missing from the JSON payload arrives
 * as {@code null} and is reported by validation instead of silently becoming
 * {@code 0.0}. JSON names follow the public dataset column names.
 * </p>
 *
 * <h2>Feature descriptions:</h2>
 * <ul>
 *   <li><b>MedInc</b> – median income in the block group (tens of thousands USD).</li>
 *   <li><b>HouseAge</b> – median house age in years.</li>
 *   <li><b>AveRooms</b> – average number of rooms per household.</li>
 *   <li><b>AveBedrms</b> – average number of bedrooms per household.</li>
 *   <li><b>Population</b> – block group population.</li>
 *   <li><b>AveOccup</b> – average number of household members.</li>
 *   <li><b>Latitude</b> / <b>Longitude</b> – block group location, bounded to California.</li>
 * </ul>
 *
 * <h2>Usage Example:</h2>
 * <pre>{@code
 * HousingFeatures f = new HousingFeatures(
 *     8.33, 41.0, 6.98, 1.02, 322.0, 2.56, 37.88, -122.23);
 * double[] x = f.toVector();
 * }</pre>
 */
public record HousingFeatures(
        @JsonProperty("MedInc") Double medInc,
        @JsonProperty("HouseAge") Double houseAge,
        @JsonProperty("AveRooms") Double aveRooms,
        @JsonProperty("AveBedrms") Double aveBedrms,
        @JsonProperty("Population") Double population,
        @JsonProperty("AveOccup") Double aveOccup,
        @JsonProperty("Latitude") Double latitude,
        @JsonProperty("Longitude") Double longitude) {

    /** Model input vector in {@link com.example.retrain.store.FeatureDomain} order. Requires every field present. */
    public double[] toVector() {
        return new double[] {
                medInc, houseAge, aveRooms, aveBedrms,
                population, aveOccup, latitude, longitude
        };
    }
}
