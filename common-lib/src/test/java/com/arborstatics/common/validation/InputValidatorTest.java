package com.arborstatics.common.validation;

import com.arborstatics.common.model.CalculationResult;
import com.arborstatics.common.model.ValidationIssue;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class InputValidatorTest {

    private static List<ValidationIssue> errors(List<ValidationIssue> issues) {
        return issues.stream().filter(ValidationIssue::isError).toList();
    }

    private static List<ValidationIssue> warnings(List<ValidationIssue> issues) {
        return issues.stream().filter(i -> !i.isError()).toList();
    }

    private static boolean mentions(List<ValidationIssue> issues, String fragment) {
        return issues.stream().anyMatch(i -> i.message().contains(fragment));
    }

    @Nested
    @DisplayName("errors")
    class ErrorTests {

        @Test
        @DisplayName("typical tree raises no issues")
        void typicalTree_clean() {
            assertTrue(InputValidator.validate(50.0, 18.0, 10.0, 40.0, null).isEmpty());
        }

        @Test
        @DisplayName("every missing required field is reported independently")
        void allMissing_fourErrors() {
            List<ValidationIssue> issues = InputValidator.validate(null, null, null, null, null);
            assertEquals(4, errors(issues).size());
            assertTrue(InputValidator.hasErrors(issues));
        }

        @Test
        @DisplayName("zero and negative values are errors, in field order")
        void nonPositive_errors() {
            List<ValidationIssue> issues = InputValidator.validate(0.0, -1.0, 0.0, -5.0, null);
            List<String> messages = errors(issues).stream().map(ValidationIssue::message).toList();
            assertEquals(List.of(
                "DBH must be greater than zero.",
                "Height must be greater than zero.",
                "Crown diameter must be greater than zero.",
                "Design wind speed must be greater than zero."), messages);
        }

        @Test
        @DisplayName("NaN counts as not positive")
        void nan_error() {
            List<ValidationIssue> issues = InputValidator.validate(Double.NaN, 18.0, 10.0, 40.0, null);
            assertTrue(mentions(errors(issues), "DBH"));
        }
    }

    @Nested
    @DisplayName("warnings")
    class WarningTests {

        @Test
        @DisplayName("wind above 80 m/s warns but does not block")
        void highWind_warning() {
            List<ValidationIssue> issues = InputValidator.validate(50.0, 18.0, 10.0, 85.0, null);
            assertFalse(InputValidator.hasErrors(issues));
            assertTrue(mentions(warnings(issues), "80 m/s"));
        }

        @Test
        @DisplayName("wind of exactly 80 m/s is not flagged")
        void boundaryWind_clean() {
            assertTrue(InputValidator.validate(50.0, 18.0, 10.0, 80.0, null).isEmpty());
        }

        @Test
        @DisplayName("negative cavity warns that it is treated as zero")
        void negativeCavity_warning() {
            List<ValidationIssue> issues = InputValidator.validate(50.0, 18.0, 10.0, 40.0, -3.0);
            assertEquals(1, issues.size());
            assertTrue(mentions(issues, "treated as zero"));
        }

        @Test
        @DisplayName("cavity ≥ DBH warns about the 99% cap")
        void oversizedCavity_warning() {
            assertTrue(mentions(InputValidator.validate(50.0, 18.0, 10.0, 40.0, 50.0), "99%"));
            assertTrue(mentions(InputValidator.validate(50.0, 18.0, 10.0, 40.0, 70.0), "99%"));
            assertTrue(InputValidator.validate(50.0, 18.0, 10.0, 40.0, 49.0).isEmpty());
        }

        @Test
        @DisplayName("height under twice the DBH in metres is atypical")
        void squatGeometry_warning() {
            // 120 cm DBH → 2.4 m threshold
            List<ValidationIssue> issues = InputValidator.validate(120.0, 2.0, 3.0, 40.0, null);
            assertTrue(mentions(warnings(issues), "very low relative to stem diameter"));
        }

        @Test
        @DisplayName("crown wider than twice the height warns")
        void wideCrown_warning() {
            List<ValidationIssue> issues = InputValidator.validate(30.0, 5.0, 11.0, 40.0, null);
            assertTrue(mentions(warnings(issues), "Crown diameter is very large"));
        }

        @Test
        @DisplayName("one input may raise errors and warnings together")
        void mixed() {
            List<ValidationIssue> issues = InputValidator.validate(50.0, 18.0, 10.0, null, 60.0);
            assertEquals(1, errors(issues).size());
            assertEquals(1, warnings(issues).size());
        }
    }

    @Nested
    @DisplayName("postCalculationWarnings()")
    class PostCalculationTests {

        private CalculationResult withSafetyFactor(double sf) {
            return new CalculationResult(960.0, 1000.0, 10000.0, 1.0, sf);
        }

        @Test
        @DisplayName("SF above 5 warns")
        void highSafetyFactor_warning() {
            List<ValidationIssue> issues = InputValidator.postCalculationWarnings(withSafetyFactor(6.2));
            assertEquals(1, issues.size());
            assertFalse(issues.get(0).isError());
        }

        @Test
        @DisplayName("SF at or below 5, and infinite SF, do not warn")
        void otherwise_clean() {
            assertTrue(InputValidator.postCalculationWarnings(withSafetyFactor(5.0)).isEmpty());
            assertTrue(InputValidator.postCalculationWarnings(withSafetyFactor(1.2)).isEmpty());
            assertTrue(InputValidator.postCalculationWarnings(withSafetyFactor(Double.POSITIVE_INFINITY)).isEmpty());
            assertTrue(InputValidator.postCalculationWarnings(null).isEmpty());
        }
    }
}
