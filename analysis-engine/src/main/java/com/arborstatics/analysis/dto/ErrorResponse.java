package com.arborstatics.analysis.dto;

import com.arborstatics.common.model.ValidationIssue;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record ErrorResponse(
    @JsonProperty("error")   String error,
    @JsonProperty("message") String message,
    @JsonProperty("issues")  List<ValidationIssue> issues
) {}
