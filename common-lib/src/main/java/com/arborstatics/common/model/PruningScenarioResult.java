package com.arborstatics.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Before/after results for a crown reduction scenario, together with the
 * crown diameter (m) and fullness actually used for each run.
 */
public record PruningScenarioResult(
    @JsonProperty("before")              CalculationResult before,
    @JsonProperty("after")               CalculationResult after,
    @JsonProperty("crownDiameterBefore") double crownDiameterBefore,
    @JsonProperty("crownDiameterAfter")  double crownDiameterAfter,
    @JsonProperty("fullnessBefore")      double fullnessBefore,
    @JsonProperty("fullnessAfter")       double fullnessAfter
) {}
