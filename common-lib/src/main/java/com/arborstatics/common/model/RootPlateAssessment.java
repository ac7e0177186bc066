package com.arborstatics.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Root-plate anchorage score in [0.2, 1.1] with its risk band. Not part of
 * the bending safety factor.
 */
public record RootPlateAssessment(
    @JsonProperty("stabilityFactor") double stabilityFactor,
    @JsonProperty("risk")            RootPlateRisk risk
) {}
