package com.arborstatics.common.rootplate;

import com.arborstatics.common.model.RootPlateAssessment;
import com.arborstatics.common.model.RootPlateObservations;
import com.arborstatics.common.model.RootPlateRisk;

/**
 * Scores root-plate anchorage from soil, lean and root-zone observations.
 *
 * <p>The score is advisory: it drives the root-plate risk band only and is
 * never folded into the bending safety factor.
 *
 * <h3>Multipliers</h3>
 * <pre>
 *   soil type, soil moisture     per enum (rock and dry soil may exceed 1.0)
 *   lean θ &gt; 0                   ≤5° 0.95, ≤10° 0.85, ≤15° 0.70, else 0.50
 *   recent lean change           0.70
 *   heaving / cracking           0.60
 *   severed roots p %            clamp(1 − p/100 × 0.8, 0.3, 1.0)
 *   root decay                   0.75
 *   root-zone restriction        per enum
 *   plate radius r               r / (3.5 × DBH_m) &lt; 0.7 → 0.75, &lt; 0.9 → 0.90
 *   plate depth z                &lt; 0.3 m → 0.70, &lt; 0.5 m → 0.85
 * </pre>
 * The product is clamped to [{@value #MIN_FACTOR}, {@value #MAX_FACTOR}].
 */
public final class RootPlateStabilityComposer {

    public static final double MIN_FACTOR = 0.2;
    public static final double MAX_FACTOR = 1.1;

    /** Expected root-plate radius as a multiple of DBH, both in metres. */
    static final double EXPECTED_RADIUS_PER_DBH = 3.5;

    private RootPlateStabilityComposer() {}

    public static RootPlateAssessment compose(RootPlateObservations observations, Double dbhCm) {
        double factor = stabilityFactor(observations, dbhCm);
        return new RootPlateAssessment(factor, RootPlateRisk.of(factor));
    }

    public static double stabilityFactor(RootPlateObservations observations, Double dbhCm) {
        if (observations == null) return 1.0;

        double factor = 1.0;

        if (observations.soilType() != null) {
            factor *= observations.soilType().anchorageFactor();
        }
        if (observations.soilMoisture() != null) {
            factor *= observations.soilMoisture().anchorageFactor();
        }

        factor *= leanFactor(observations.leanAngleDegrees());

        if (observations.recentLeanChange())  factor *= 0.70;
        if (observations.heavingOrCracking()) factor *= 0.60;

        if (observations.severedRootsPercent() > 0.0) {
            double loss = (observations.severedRootsPercent() / 100.0) * 0.8;
            factor *= clamp(1.0 - loss, 0.3, 1.0);
        }

        if (observations.rootDecay()) factor *= 0.75;

        if (observations.restriction() != null) {
            factor *= observations.restriction().anchorageFactor();
        }

        factor *= radiusFactor(observations.rootPlateRadius(), dbhCm);
        factor *= depthFactor(observations.rootPlateDepth());

        return clamp(factor, MIN_FACTOR, MAX_FACTOR);
    }

    static double leanFactor(double leanDegrees) {
        if (!(leanDegrees > 0.0)) return 1.0;
        if (leanDegrees <= 5.0)  return 0.95;
        if (leanDegrees <= 10.0) return 0.85;
        if (leanDegrees <= 15.0) return 0.70;
        return 0.50;
    }

    static double radiusFactor(Double radiusM, Double dbhCm) {
        if (radiusM == null || !(radiusM > 0.0) || dbhCm == null || !(dbhCm > 0.0)) return 1.0;
        double expected = (dbhCm / 100.0) * EXPECTED_RADIUS_PER_DBH;
        double ratio = radiusM / expected;
        if (ratio < 0.7) return 0.75;
        if (ratio < 0.9) return 0.90;
        return 1.0;
    }

    static double depthFactor(Double depthM) {
        if (depthM == null || !(depthM > 0.0)) return 1.0;
        if (depthM < 0.3) return 0.70;
        if (depthM < 0.5) return 0.85;
        return 1.0;
    }

    private static double clamp(double value, double min, double max) {
        return Math.max(min, Math.min(max, value));
    }
}
