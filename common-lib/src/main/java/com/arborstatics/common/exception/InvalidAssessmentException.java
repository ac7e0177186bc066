package com.arborstatics.common.exception;

import com.arborstatics.common.model.ValidationIssue;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Raised when an assessment is requested while blocking validation errors
 * are present. Carries the full issue list, warnings included.
 */
public class InvalidAssessmentException extends ArborStaticsException {
    private final List<ValidationIssue> issues;

    public InvalidAssessmentException(List<ValidationIssue> issues) {
        super("InputValidator", issues.stream()
            .filter(ValidationIssue::isError)
            .map(ValidationIssue::message)
            .collect(Collectors.joining(" ")));
        this.issues = List.copyOf(issues);
    }

    public List<ValidationIssue> getIssues() {
        return issues;
    }
}
