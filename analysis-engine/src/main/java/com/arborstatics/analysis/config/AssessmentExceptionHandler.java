package com.arborstatics.analysis.config;

import com.arborstatics.analysis.dto.ErrorResponse;
import com.arborstatics.common.exception.CatalogueLoadException;
import com.arborstatics.common.exception.InvalidAssessmentException;
import com.arborstatics.common.exception.UnknownProfileException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.List;

/**
 * Maps engine exceptions onto HTTP responses.
 */
@RestControllerAdvice
public class AssessmentExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(AssessmentExceptionHandler.class);

    /** Blocking validation errors: 400 with the full issue list. */
    @ExceptionHandler(InvalidAssessmentException.class)
    public ResponseEntity<ErrorResponse> handleInvalid(InvalidAssessmentException ex) {
        log.debug("[AssessmentExceptionHandler] Invalid assessment input: {}", ex.getMessage());
        return ResponseEntity.badRequest()
            .body(new ErrorResponse("INVALID_INPUT", ex.getMessage(), ex.getIssues()));
    }

    @ExceptionHandler(UnknownProfileException.class)
    public ResponseEntity<ErrorResponse> handleUnknownProfile(UnknownProfileException ex) {
        log.debug("[AssessmentExceptionHandler] Unknown profile requested: {}", ex.getProfileId());
        return ResponseEntity.status(HttpStatus.NOT_FOUND)
            .body(new ErrorResponse("UNKNOWN_PROFILE", ex.getMessage(), List.of()));
    }

    @ExceptionHandler(CatalogueLoadException.class)
    public ResponseEntity<ErrorResponse> handleCatalogue(CatalogueLoadException ex) {
        log.error("[AssessmentExceptionHandler] Catalogue unavailable: {}", ex.getMessage(), ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
            .body(new ErrorResponse("CATALOGUE_UNAVAILABLE", ex.getMessage(), List.of()));
    }
}
