package com.arborstatics.common.validation;

import com.arborstatics.common.model.CalculationResult;
import com.arborstatics.common.model.ValidationIssue;

import java.util.ArrayList;
import java.util.List;

/**
 * Range and sanity checks on raw assessment inputs.
 *
 * <p>Every rule is evaluated independently, so one input may raise several
 * issues. Errors ({@code isError = true}) must block calculation; warnings
 * describe how the engine will normalise or interpret the input and never
 * block.
 *
 * <h3>Units</h3>
 * <pre>
 *   dbh, cavityInnerDiameter   cm
 *   height, crownDiameter      m
 *   designWindSpeed            m/s
 * </pre>
 *
 * <p>Pure static utility. Nullable inputs represent fields left blank.
 */
public final class InputValidator {

    static final double MAX_PLAUSIBLE_WIND_MS      = 80.0;
    static final double HIGH_SAFETY_FACTOR_WARNING = 5.0;

    private InputValidator() {}

    public static List<ValidationIssue> validate(Double dbh,
                                                 Double height,
                                                 Double crownDiameter,
                                                 Double designWindSpeed,
                                                 Double cavityInnerDiameter) {
        List<ValidationIssue> issues = new ArrayList<>();

        if (!isPositive(dbh)) {
            issues.add(ValidationIssue.error("DBH must be greater than zero."));
        }
        if (!isPositive(height)) {
            issues.add(ValidationIssue.error("Height must be greater than zero."));
        }
        if (!isPositive(crownDiameter)) {
            issues.add(ValidationIssue.error("Crown diameter must be greater than zero."));
        }
        if (!isPositive(designWindSpeed)) {
            issues.add(ValidationIssue.error("Design wind speed must be greater than zero."));
        }

        if (designWindSpeed != null && designWindSpeed > MAX_PLAUSIBLE_WIND_MS) {
            issues.add(ValidationIssue.warning(
                "Design wind speed above 80 m/s (~288 km/h) is likely unrealistic for most sites."));
        }

        if (cavityInnerDiameter != null && cavityInnerDiameter < 0) {
            issues.add(ValidationIssue.warning(
                "Cavity inner diameter cannot be negative. It will be treated as zero."));
        }

        if (isPositive(dbh) && cavityInnerDiameter != null && cavityInnerDiameter >= dbh) {
            issues.add(ValidationIssue.warning(
                "Cavity inner diameter is equal to or greater than DBH. "
                    + "It will be capped at 99% of DBH for calculations."));
        }

        if (dbh != null && isPositive(height) && height < 2.0 * (dbh / 100.0)) {
            issues.add(ValidationIssue.warning(
                "Height is very low relative to stem diameter; geometry may be atypical."));
        }

        if (height != null && crownDiameter != null && crownDiameter > 2.0 * height) {
            issues.add(ValidationIssue.warning(
                "Crown diameter is very large relative to height; check measurements."));
        }

        return List.copyOf(issues);
    }

    /**
     * Advisory checks on a finished calculation.
     */
    public static List<ValidationIssue> postCalculationWarnings(CalculationResult result) {
        if (result == null) return List.of();
        double sf = result.safetyFactor();
        if (Double.isFinite(sf) && sf > HIGH_SAFETY_FACTOR_WARNING) {
            return List.of(ValidationIssue.warning(
                "Unusually high safety factor; check that inputs and presets are realistic."));
        }
        return List.of();
    }

    public static boolean hasErrors(List<ValidationIssue> issues) {
        return issues != null && issues.stream().anyMatch(ValidationIssue::isError);
    }

    private static boolean isPositive(Double value) {
        return value != null && value > 0.0;
    }
}
