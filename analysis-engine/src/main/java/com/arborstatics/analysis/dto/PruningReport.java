package com.arborstatics.analysis.dto;

import com.arborstatics.common.model.Curve;
import com.arborstatics.common.model.PruningScenarioResult;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Before/after comparison for the requested reduction plus the after-SF
 * curve for reductions up to it.
 */
public record PruningReport(
    @JsonProperty("scenario")       PruningScenarioResult scenario,
    @JsonProperty("reductionCurve") Curve reductionCurve
) {}
