package com.arborstatics.analysis.dto;

import com.arborstatics.common.model.CalculationResult;
import com.arborstatics.common.model.Curve;
import com.arborstatics.common.model.DecayAnalysis;
import com.arborstatics.common.model.RootPlateAssessment;
import com.arborstatics.common.model.SafetyMarginRating;
import com.arborstatics.common.model.ValidationIssue;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Map;

/**
 * Everything the presentation layer needs for one tree. Nullable fields:
 * {@code windToFailure} (no threshold), {@code rootPlate} (not assessed).
 */
public record AssessmentReport(
    @JsonProperty("speciesId")            String speciesId,
    @JsonProperty("designWindSpeed")      double designWindSpeed,
    @JsonProperty("issues")               List<ValidationIssue> issues,
    @JsonProperty("defectStrengthFactor") double defectStrengthFactor,
    @JsonProperty("effectiveFullness")    double effectiveFullness,
    @JsonProperty("result")               CalculationResult result,
    @JsonProperty("rating")               SafetyMarginRating rating,
    @JsonProperty("windToFailure")        Double windToFailure,
    @JsonProperty("rootPlate")            RootPlateAssessment rootPlate,
    @JsonProperty("decay")                DecayAnalysis decay,
    @JsonProperty("safetyFactorVsWind")   Curve safetyFactorVsWind,
    @JsonProperty("decayTolerance")       Curve decayTolerance,
    @JsonProperty("windScenarios")        Map<String, Double> windScenarios
) {}
