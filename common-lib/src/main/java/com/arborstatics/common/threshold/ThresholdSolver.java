package com.arborstatics.common.threshold;

import com.arborstatics.common.model.CalculationResult;
import com.arborstatics.common.model.Curve;
import com.arborstatics.common.model.CurvePoint;
import com.arborstatics.common.model.LoadScenario;
import com.arborstatics.common.model.SpeciesProfile;
import com.arborstatics.common.model.TreeGeometry;
import com.arborstatics.common.section.SectionLoadCalculator;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.OptionalDouble;

/**
 * Locates the points where the modelled safety factor reaches 1.
 *
 * <h3>Wind-to-failure</h3>
 * <p>Stress is proportional to V² and nothing else in the model depends on
 * wind, so {@code SF(V) = SF_d (V_d / V)²} and the crossing is closed-form:
 * <pre>
 *   V_fail = V_d × √SF_d
 * </pre>
 *
 * <h3>Critical residual wall</h3>
 * <p>The hollow section modulus is quartic in the cavity diameter, so the
 * residual wall at SF = 1 is found by bisection on
 * [{@code lowerResidualPercent}, {@code upperResidualPercent}]. SF is
 * monotonically increasing in residual wall: SF &gt; 1 moves the bracket
 * down, SF &lt; 1 moves it up. A non-finite SF (zero stress) counts as the
 * high side.
 *
 * <p>Nothing here throws for an unreachable threshold. An empty
 * {@link OptionalDouble} means "no threshold in range".
 */
public final class ThresholdSolver {

    static final double DECAY_CURVE_MIN_WIND_MS = 15.0;
    static final double DECAY_CURVE_FLOOR_MAX_WIND_MS = 50.0;
    static final double DECAY_CURVE_CEILING_MAX_WIND_MS = 80.0;
    static final double DECAY_CURVE_DESIGN_MULTIPLIER = 1.5;
    static final double FAILURE_HEADROOM = 1.1;
    static final int    DECAY_CURVE_STEPS = 10;

    private ThresholdSolver() {}

    // ── Wind-to-failure ─────────────────────────────────────────────────────

    public static OptionalDouble windToFailure(SpeciesProfile species,
                                               TreeGeometry geometry,
                                               LoadScenario scenario) {
        if (!(scenario.designWindSpeed() > 0.0)) return OptionalDouble.empty();
        CalculationResult reference = SectionLoadCalculator.evaluate(species, geometry, scenario);
        return windToFailure(scenario.designWindSpeed(), reference.safetyFactor());
    }

    public static OptionalDouble windToFailure(double designWindSpeed, double designSafetyFactor) {
        if (!Double.isFinite(designSafetyFactor) || designSafetyFactor <= 0.0) {
            return OptionalDouble.empty();
        }
        if (!(designWindSpeed > 0.0)) return OptionalDouble.empty();
        return OptionalDouble.of(designWindSpeed * Math.sqrt(designSafetyFactor));
    }

    // ── Critical residual wall ──────────────────────────────────────────────

    /**
     * @return residual wall % of DBH at which SF ≈ 1 for {@code windSpeed},
     *         strictly inside the search bracket, or empty
     */
    public static OptionalDouble criticalResidualWall(SpeciesProfile species,
                                                      TreeGeometry geometry,
                                                      LoadScenario scenario,
                                                      double windSpeed,
                                                      SolverSettings settings) {
        LoadScenario atWind = scenario.withWindSpeed(windSpeed);
        double low  = settings.lowerResidualPercent();
        double high = settings.upperResidualPercent();

        for (int i = 0; i < settings.maxIterations(); i++) {
            double mid = (low + high) / 2.0;
            double sf = SectionLoadCalculator
                .evaluateAtResidualWall(species, geometry, atWind, mid)
                .safetyFactor();

            if (!Double.isFinite(sf)) {
                high = mid;
                continue;
            }
            if (Math.abs(sf - 1.0) < settings.tolerance()) {
                return insideBracket(mid, settings) ? OptionalDouble.of(mid) : OptionalDouble.empty();
            }
            if (sf > 1.0) {
                high = mid;
            } else {
                low = mid;
            }
        }
        return OptionalDouble.empty();
    }

    /**
     * Critical residual wall against wind speed. Wind samples run from
     * 15 m/s to {@code clamp(1.5 V_d, 50, 80)}, raised to {@code 1.1 V_fail}
     * when the tree would survive beyond that. Only samples with a threshold
     * in range are kept.
     */
    public static Curve decayToleranceCurve(SpeciesProfile species,
                                            TreeGeometry geometry,
                                            LoadScenario scenario,
                                            SolverSettings settings) {
        List<CurvePoint> points = new ArrayList<>();
        for (double wind : decayToleranceWindSpeeds(species, geometry, scenario)) {
            decayTolerancePoint(species, geometry, scenario, wind, settings).ifPresent(points::add);
        }
        return new Curve(points);
    }

    /**
     * One sample of the decay tolerance curve: (wind, critical residual wall),
     * or empty when there is no threshold in range at that wind.
     */
    public static Optional<CurvePoint> decayTolerancePoint(SpeciesProfile species,
                                                           TreeGeometry geometry,
                                                           LoadScenario scenario,
                                                           double windSpeed,
                                                           SolverSettings settings) {
        OptionalDouble rw = criticalResidualWall(species, geometry, scenario, windSpeed, settings);
        return rw.isPresent() ? Optional.of(new CurvePoint(windSpeed, rw.getAsDouble())) : Optional.empty();
    }

    public static double[] decayToleranceWindSpeeds(SpeciesProfile species,
                                                    TreeGeometry geometry,
                                                    LoadScenario scenario) {
        double maxV = Math.max(DECAY_CURVE_FLOOR_MAX_WIND_MS,
            Math.min(DECAY_CURVE_CEILING_MAX_WIND_MS,
                scenario.designWindSpeed() * DECAY_CURVE_DESIGN_MULTIPLIER));

        OptionalDouble failure = windToFailure(species, geometry, scenario);
        if (failure.isPresent() && failure.getAsDouble() > maxV) {
            maxV = failure.getAsDouble() * FAILURE_HEADROOM;
        }

        double[] winds = new double[DECAY_CURVE_STEPS];
        for (int i = 0; i < DECAY_CURVE_STEPS; i++) {
            winds[i] = DECAY_CURVE_MIN_WIND_MS
                + (maxV - DECAY_CURVE_MIN_WIND_MS) * i / (DECAY_CURVE_STEPS - 1);
        }
        return winds;
    }

    /** Sound wall thickness in cm for a residual wall percentage of DBH. */
    public static double criticalWallThicknessCm(double dbhCm, double residualPercent) {
        return dbhCm * (residualPercent / 100.0) / 2.0;
    }

    private static boolean insideBracket(double residualPercent, SolverSettings settings) {
        return residualPercent > settings.lowerResidualPercent()
            && residualPercent < settings.upperResidualPercent();
    }
}
