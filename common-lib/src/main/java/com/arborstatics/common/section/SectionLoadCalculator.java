package com.arborstatics.common.section;

import com.arborstatics.common.model.CalculationResult;
import com.arborstatics.common.model.LoadScenario;
import com.arborstatics.common.model.SpeciesProfile;
import com.arborstatics.common.model.TreeGeometry;

/**
 * Cantilever-beam statics for one stem section under a static wind load.
 *
 * <h3>Model</h3>
 * <pre>
 *   q       = siteFactor × ½ × ρ_air × V²                    (Pa)
 *   A       = π (D_crown / 2)² × k_A × fullness              (m²)
 *   F       = q × C_d × A                                    (N)
 *   M       = F × 0.66 H                                     (N·m)
 *   W_solid = π d³ / 32
 *   W_hollow= π (d⁴ − d_i⁴) / (32 d)                         (m³)
 *   σ       = M / W / 1e6                                    (MPa)
 *   SF      = f_b × k_defect / σ,   +∞ when σ ≤ 0
 * </pre>
 *
 * <p>The crown load acts at an effective height of 0.66 H, the equivalent
 * point of a distributed crown load. Fullness is clamped to [0.1, 1.0] and a
 * cavity at or beyond the DBH is capped to 99 % of it, so the hollow section
 * modulus never reaches zero.
 *
 * <p>Pure static utility: no state, no I/O, no logging. Identical inputs give
 * bit-identical results.
 */
public final class SectionLoadCalculator {

    public static final double AIR_DENSITY_KG_M3 = 1.2;
    public static final double EFFECTIVE_HEIGHT_RATIO = 0.66;
    public static final double MIN_FULLNESS = 0.1;
    public static final double MAX_FULLNESS = 1.0;
    public static final double MAX_CAVITY_RATIO = 0.99;

    private SectionLoadCalculator() {}

    public static CalculationResult evaluate(SpeciesProfile species,
                                             TreeGeometry geometry,
                                             LoadScenario scenario) {
        double dOuter = geometry.diameterAtBreastHeight() / 100.0;
        double dInner = effectiveInnerDiameterCm(
            geometry.diameterAtBreastHeight(), geometry.cavityInnerDiameter()) / 100.0;

        double v = scenario.designWindSpeed();
        double q = scenario.siteFactor() * 0.5 * AIR_DENSITY_KG_M3 * v * v;

        double crownRadius = geometry.crownDiameter() / 2.0;
        double planArea = Math.PI * crownRadius * crownRadius;
        double fullness = effectiveFullness(species, scenario.fullnessOverride());
        double area = planArea * species.crownShapeFactor() * fullness;

        double windForce = q * species.dragCoefficient() * area;
        double leverArm = EFFECTIVE_HEIGHT_RATIO * geometry.height();
        double moment = windForce * leverArm;

        double w = sectionModulus(dOuter, dInner);
        double stressMPa = (moment / w) / 1e6;

        double effectiveStrength = species.greenBendingStrength() * scenario.defectStrengthFactor();
        double safetyFactor = stressMPa > 0.0
            ? effectiveStrength / stressMPa
            : Double.POSITIVE_INFINITY;

        return new CalculationResult(q, windForce, moment, stressMPa, safetyFactor);
    }

    /**
     * Evaluates the same tree with its cavity replaced by one leaving
     * {@code residualPercent} of DBH as sound wall.
     */
    public static CalculationResult evaluateAtResidualWall(SpeciesProfile species,
                                                           TreeGeometry geometry,
                                                           LoadScenario scenario,
                                                           double residualPercent) {
        Double cavity = cavityForResidualWall(geometry.diameterAtBreastHeight(), residualPercent);
        return evaluate(species, geometry.withCavity(cavity), scenario);
    }

    /**
     * Section modulus in m³. Hollow when {@code innerDiameterM > 0}, otherwise solid.
     */
    public static double sectionModulus(double outerDiameterM, double innerDiameterM) {
        if (innerDiameterM > 0.0) {
            return Math.PI * (Math.pow(outerDiameterM, 4) - Math.pow(innerDiameterM, 4))
                / (32.0 * outerDiameterM);
        }
        return Math.PI * Math.pow(outerDiameterM, 3) / 32.0;
    }

    /**
     * Inner diameter actually used, in cm: 0 for no (or a negative) cavity,
     * otherwise the cavity capped to 99 % of DBH.
     */
    public static double effectiveInnerDiameterCm(double dbhCm, Double cavityCm) {
        if (cavityCm == null || !(cavityCm > 0.0)) return 0.0;
        return cavityCm >= dbhCm ? dbhCm * MAX_CAVITY_RATIO : cavityCm;
    }

    /**
     * Crown fullness actually used: the override when present, else the
     * species default, clamped to [0.1, 1.0].
     */
    public static double effectiveFullness(SpeciesProfile species, Double fullnessOverride) {
        double base = fullnessOverride != null ? fullnessOverride : species.defaultFullness();
        return clampFullness(base);
    }

    public static double clampFullness(double fullness) {
        if (Double.isNaN(fullness)) return MAX_FULLNESS;
        return Math.max(MIN_FULLNESS, Math.min(MAX_FULLNESS, fullness));
    }

    /**
     * Residual wall as a fraction of DBH (0-1) implied by a measured cavity.
     * 1.0 means solid.
     */
    public static double residualWallFraction(double dbhCm, Double cavityCm) {
        if (dbhCm <= 0.0) return 1.0;
        double inner = effectiveInnerDiameterCm(dbhCm, cavityCm);
        if (inner <= 0.0) return 1.0;
        double fraction = (dbhCm - inner) / dbhCm;
        return Math.max(0.0, Math.min(1.0, fraction));
    }

    /**
     * Cavity diameter in cm that leaves {@code residualPercent} of DBH as
     * wall, or {@code null} when nothing is hollow.
     */
    public static Double cavityForResidualWall(double dbhCm, double residualPercent) {
        double cavity = dbhCm * (1.0 - residualPercent / 100.0);
        return cavity > 0.0 ? cavity : null;
    }
}
