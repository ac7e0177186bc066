package com.arborstatics.common.scenario;

import com.arborstatics.common.model.CalculationResult;
import com.arborstatics.common.model.Curve;
import com.arborstatics.common.model.CurvePoint;
import com.arborstatics.common.model.DecayAnalysis;
import com.arborstatics.common.model.LoadScenario;
import com.arborstatics.common.model.PruningScenarioResult;
import com.arborstatics.common.model.SpeciesProfile;
import com.arborstatics.common.model.TreeGeometry;
import com.arborstatics.common.model.WindProfile;
import com.arborstatics.common.section.SectionLoadCalculator;
import com.arborstatics.common.threshold.ThresholdSolver;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalDouble;

/**
 * Parametric sweeps and before/after comparisons built by re-running
 * {@link SectionLoadCalculator#evaluate} at varied inputs.
 *
 * <h3>Sweeps</h3>
 * <pre>
 *   SF vs wind            12 samples, max(5, 0.5 V) .. max(1.8 V, 1.1 V_fail)
 *   SF vs crown reduction  9 samples, 0 .. clamp(r, 5, 40)   (10 when r ≤ 0)
 *   SF vs residual wall    9 samples, 20 .. 100 %
 * </pre>
 *
 * <p>Every sample is independent of every other, so callers may compute
 * them in any order or in parallel. Pure static utility.
 */
public final class ScenarioGenerator {

    static final int    WIND_STEPS = 12;
    static final double WIND_MIN_MS = 5.0;
    static final double WIND_LOW_MULTIPLIER = 0.5;
    static final double WIND_HIGH_MULTIPLIER = 1.8;
    static final double WIND_FAILURE_HEADROOM = 1.1;

    static final int    REDUCTION_STEPS = 9;
    static final double REDUCTION_DEFAULT_MAX = 10.0;
    static final double REDUCTION_MIN_MAX = 5.0;
    static final double REDUCTION_MAX_MAX = 40.0;

    static final int    RESIDUAL_STEPS = 9;
    static final double RESIDUAL_MIN_PERCENT = 20.0;
    static final double RESIDUAL_MAX_PERCENT = 100.0;

    private ScenarioGenerator() {}

    // ── Pruning ─────────────────────────────────────────────────────────────

    /**
     * Before/after SF for a crown reduction. Crown diameter and fullness are
     * reduced independently; each reduction is clamped to [0, 100] % and the
     * reduced fullness is re-clamped to [0.1, 1.0].
     */
    public static PruningScenarioResult pruningScenario(SpeciesProfile species,
                                                        TreeGeometry geometry,
                                                        LoadScenario scenario,
                                                        double crownReductionPercent,
                                                        double fullnessReductionPercent) {
        double fullnessBefore = SectionLoadCalculator.effectiveFullness(species, scenario.fullnessOverride());
        CalculationResult before = SectionLoadCalculator.evaluate(
            species, geometry, scenario.withFullness(fullnessBefore));

        double crownBefore = geometry.crownDiameter();
        double crownAfter = crownBefore * (1.0 - clampPercent(crownReductionPercent) / 100.0);
        double fullnessAfter = SectionLoadCalculator.clampFullness(
            fullnessBefore * (1.0 - clampPercent(fullnessReductionPercent) / 100.0));

        CalculationResult after = SectionLoadCalculator.evaluate(
            species, geometry.withCrownDiameter(crownAfter), scenario.withFullness(fullnessAfter));

        return new PruningScenarioResult(before, after, crownBefore, crownAfter, fullnessBefore, fullnessAfter);
    }

    // ── Sweeps ──────────────────────────────────────────────────────────────

    public static Curve safetyFactorVsWind(SpeciesProfile species,
                                           TreeGeometry geometry,
                                           LoadScenario scenario) {
        List<CurvePoint> points = new ArrayList<>(WIND_STEPS);
        for (double v : windSweep(species, geometry, scenario)) {
            points.add(new CurvePoint(v, safetyFactorAtWind(species, geometry, scenario, v)));
        }
        return new Curve(points);
    }

    /**
     * Wind speeds sampled by {@link #safetyFactorVsWind}. Empty when the
     * design wind speed is not positive.
     */
    public static double[] windSweep(SpeciesProfile species, TreeGeometry geometry, LoadScenario scenario) {
        double design = scenario.designWindSpeed();
        if (!(design > 0.0)) return new double[0];

        double minV = Math.max(WIND_MIN_MS, design * WIND_LOW_MULTIPLIER);
        double maxV = design * WIND_HIGH_MULTIPLIER;
        OptionalDouble failure = ThresholdSolver.windToFailure(species, geometry, scenario);
        if (failure.isPresent()) {
            maxV = Math.max(maxV, failure.getAsDouble() * WIND_FAILURE_HEADROOM);
        }
        if (maxV <= minV) {
            maxV = minV + 5.0;
        }
        return linearSteps(minV, maxV, WIND_STEPS);
    }

    public static double safetyFactorAtWind(SpeciesProfile species,
                                            TreeGeometry geometry,
                                            LoadScenario scenario,
                                            double windSpeed) {
        return SectionLoadCalculator.evaluate(species, geometry, scenario.withWindSpeed(windSpeed)).safetyFactor();
    }

    /**
     * After-pruning SF for crown reductions from 0 up to the requested
     * reduction (clamped to [5, 40] %), at a fixed fullness reduction.
     */
    public static Curve safetyFactorVsCrownReduction(SpeciesProfile species,
                                                     TreeGeometry geometry,
                                                     LoadScenario scenario,
                                                     double crownReductionPercent,
                                                     double fullnessReductionPercent) {
        List<CurvePoint> points = new ArrayList<>(REDUCTION_STEPS);
        for (double r : reductionSweep(crownReductionPercent)) {
            PruningScenarioResult result = pruningScenario(
                species, geometry, scenario, r, fullnessReductionPercent);
            points.add(new CurvePoint(r, result.after().safetyFactor()));
        }
        return new Curve(points);
    }

    public static double[] reductionSweep(double crownReductionPercent) {
        double maxReduction = crownReductionPercent <= 0.0
            ? REDUCTION_DEFAULT_MAX
            : Math.max(REDUCTION_MIN_MAX, Math.min(REDUCTION_MAX_MAX, crownReductionPercent));
        return linearSteps(0.0, maxReduction, REDUCTION_STEPS);
    }

    public static Curve safetyFactorVsResidualWall(SpeciesProfile species,
                                                   TreeGeometry geometry,
                                                   LoadScenario scenario) {
        List<CurvePoint> points = new ArrayList<>(RESIDUAL_STEPS);
        for (double rw : linearSteps(RESIDUAL_MIN_PERCENT, RESIDUAL_MAX_PERCENT, RESIDUAL_STEPS)) {
            double sf = SectionLoadCalculator.evaluateAtResidualWall(species, geometry, scenario, rw).safetyFactor();
            points.add(new CurvePoint(rw, sf));
        }
        return new Curve(points);
    }

    /**
     * Residual-wall curve at the scenario wind, with the SF = 1 crossing
     * interpolated linearly between the first bracketing pair of finite samples.
     */
    public static DecayAnalysis decayAnalysis(SpeciesProfile species,
                                              TreeGeometry geometry,
                                              LoadScenario scenario) {
        Curve curve = safetyFactorVsResidualWall(species, geometry, scenario);
        double currentPercent = 100.0 * SectionLoadCalculator.residualWallFraction(
            geometry.diameterAtBreastHeight(), geometry.cavityInnerDiameter());

        OptionalDouble crossing = interpolateCrossing(curve, 1.0);
        Double critical = null;
        Double thickness = null;
        if (crossing.isPresent()) {
            critical = Math.max(RESIDUAL_MIN_PERCENT, Math.min(RESIDUAL_MAX_PERCENT, crossing.getAsDouble()));
            thickness = ThresholdSolver.criticalWallThicknessCm(geometry.diameterAtBreastHeight(), critical);
        }
        return new DecayAnalysis(currentPercent, critical, thickness, curve);
    }

    /**
     * SF at each wind profile's design speed, keyed by profile id in the
     * iteration order of {@code profiles}.
     */
    public static Map<String, Double> windScenarioComparison(SpeciesProfile species,
                                                             TreeGeometry geometry,
                                                             LoadScenario scenario,
                                                             Collection<WindProfile> profiles) {
        Map<String, Double> result = new LinkedHashMap<>();
        for (WindProfile profile : profiles) {
            result.put(profile.id(),
                safetyFactorAtWind(species, geometry, scenario, profile.designWindSpeed()));
        }
        return result;
    }

    // ── Helpers ─────────────────────────────────────────────────────────────

    static OptionalDouble interpolateCrossing(Curve curve, double level) {
        List<CurvePoint> points = curve.points();
        for (int i = 0; i < points.size() - 1; i++) {
            CurvePoint a = points.get(i);
            CurvePoint b = points.get(i + 1);
            if (!Double.isFinite(a.y()) || !Double.isFinite(b.y())) continue;
            boolean brackets = (a.y() >= level && b.y() <= level) || (a.y() <= level && b.y() >= level);
            if (!brackets) continue;
            double t = b.y() != a.y() ? (level - a.y()) / (b.y() - a.y()) : 0.0;
            return OptionalDouble.of(a.x() + (b.x() - a.x()) * t);
        }
        return OptionalDouble.empty();
    }

    static double[] linearSteps(double from, double to, int steps) {
        double[] values = new double[steps];
        for (int i = 0; i < steps; i++) {
            values[i] = from + (to - from) * i / (steps - 1);
        }
        return values;
    }

    private static double clampPercent(double percent) {
        return Math.max(0.0, Math.min(100.0, percent));
    }
}
