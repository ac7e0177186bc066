package com.arborstatics.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Input validation finding. Errors block calculation; warnings are advisory.
 */
public record ValidationIssue(
    @JsonProperty("message") String message,
    @JsonProperty("isError") boolean isError
) {

    public static ValidationIssue error(String message) {
        return new ValidationIssue(message, true);
    }

    public static ValidationIssue warning(String message) {
        return new ValidationIssue(message, false);
    }
}
