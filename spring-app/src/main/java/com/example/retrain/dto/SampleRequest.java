package com.example.retrain.dto;

import com.fasterxml.jackson.annotation.JsonAlias;

/**
 * One labeled observation submitted after deployment: the features that were
 * scored and the ground-truth value that was later observed.
 *
 * <pre>{@code
 * {
 *   "features": { "MedInc": 8.33, "HouseAge": 41, ... },
 *   "label": 452.6
 * }
 * }</pre>
 *
 * {@code target} is accepted as an alias of {@code label}.
 */
public record SampleRequest(
        HousingFeatures features,
        @JsonAlias("target") Double label) {}
