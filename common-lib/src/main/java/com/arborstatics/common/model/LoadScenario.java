package com.arborstatics.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Wind load case applied to a tree.
 *
 * <p>{@code fullnessOverride} replaces the species default when non-null;
 * either way the value is clamped to [0.1, 1.0] before use.
 * {@code defectStrengthFactor} scales the species green bending strength.
 */
public record LoadScenario(
    @JsonProperty("designWindSpeed")      double designWindSpeed,
    @JsonProperty("siteFactor")           double siteFactor,
    @JsonProperty("fullnessOverride")     Double fullnessOverride,
    @JsonProperty("defectStrengthFactor") double defectStrengthFactor
) {

    public static LoadScenario of(double designWindSpeed) {
        return new LoadScenario(designWindSpeed, 1.0, null, 1.0);
    }

    public LoadScenario withWindSpeed(double windSpeed) {
        return new LoadScenario(windSpeed, siteFactor, fullnessOverride, defectStrengthFactor);
    }

    public LoadScenario withFullness(Double fullness) {
        return new LoadScenario(designWindSpeed, siteFactor, fullness, defectStrengthFactor);
    }

    public LoadScenario withDefectStrengthFactor(double factor) {
        return new LoadScenario(designWindSpeed, siteFactor, fullnessOverride, factor);
    }
}
