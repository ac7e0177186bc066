package com.arborstatics.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Decay progression summary at one wind speed.
 *
 * <ul>
 *   <li>{@code currentResidualPercent}: residual wall implied by the measured cavity</li>
 *   <li>{@code criticalResidualPercent}: residual wall at which SF ≈ 1, or {@code null}
 *       when the SF curve does not cross 1 in the sampled range</li>
 *   <li>{@code criticalWallThickness}: wall thickness in cm at the critical point</li>
 *   <li>{@code curve}: SF against residual wall %</li>
 * </ul>
 */
public record DecayAnalysis(
    @JsonProperty("currentResidualPercent")  double currentResidualPercent,
    @JsonProperty("criticalResidualPercent") Double criticalResidualPercent,
    @JsonProperty("criticalWallThickness")   Double criticalWallThickness,
    @JsonProperty("curve")                   Curve curve
) {}
