package com.arborstatics.analysis.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

public record PruningRequest(
    @JsonProperty("assessment")               AssessmentRequest assessment,
    @JsonProperty("crownReductionPercent")    double crownReductionPercent,
    @JsonProperty("fullnessReductionPercent") double fullnessReductionPercent
) {}
