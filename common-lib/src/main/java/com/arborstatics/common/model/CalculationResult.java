package com.arborstatics.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Result for a single section under one wind scenario.
 *
 * <p>Units: Pa, N, N·m, MPa. {@code safetyFactor} is
 * {@link Double#POSITIVE_INFINITY} when the modelled stress is zero, which is
 * a valid state (no wind) and not an error.
 */
public record CalculationResult(
    @JsonProperty("windPressure")  double windPressure,
    @JsonProperty("windForce")     double windForce,
    @JsonProperty("bendingMoment") double bendingMoment,
    @JsonProperty("bendingStress") double bendingStress,
    @JsonProperty("safetyFactor")  double safetyFactor
) {

    public boolean hasFiniteSafetyFactor() {
        return Double.isFinite(safetyFactor);
    }
}
