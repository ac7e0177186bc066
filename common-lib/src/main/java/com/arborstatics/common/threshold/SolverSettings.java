package com.arborstatics.common.threshold;

/**
 * Bisection parameters for the residual-wall search.
 *
 * @param maxIterations         bisection steps before giving up
 * @param tolerance             accepted |SF − 1|
 * @param lowerResidualPercent  bracket lower bound, % of DBH retained as wall
 * @param upperResidualPercent  bracket upper bound
 */
public record SolverSettings(
    int    maxIterations,
    double tolerance,
    double lowerResidualPercent,
    double upperResidualPercent
) {

    public static final SolverSettings DEFAULT = new SolverSettings(25, 0.01, 10.0, 100.0);

    public SolverSettings {
        if (maxIterations < 1) {
            throw new IllegalArgumentException("maxIterations must be >= 1, got " + maxIterations);
        }
        if (!(tolerance > 0.0)) {
            throw new IllegalArgumentException("tolerance must be > 0, got " + tolerance);
        }
        if (!(lowerResidualPercent < upperResidualPercent)) {
            throw new IllegalArgumentException("residual bracket is empty: ["
                + lowerResidualPercent + ", " + upperResidualPercent + "]");
        }
    }
}
