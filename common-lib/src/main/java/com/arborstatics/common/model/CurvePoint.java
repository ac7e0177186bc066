package com.arborstatics.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/** One sample of a parametric sweep. */
public record CurvePoint(
    @JsonProperty("x") double x,
    @JsonProperty("y") double y
) {}
