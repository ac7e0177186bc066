package com.arborstatics.common.defect;

import com.arborstatics.common.model.DecayLocation;
import com.arborstatics.common.model.DecaySeverity;
import com.arborstatics.common.model.DecayType;
import com.arborstatics.common.model.DefectObservations;

/**
 * Converts observed structural defects and decay into the dimensionless
 * strength reduction factor k_defect applied to the species green bending
 * strength.
 *
 * <h3>Composition</h3>
 * <p>Each observation contributes an independent multiplier (1.0 when
 * absent). All multipliers compound, and the product is clamped to
 * [{@value #MIN_FACTOR}, {@value #MAX_FACTOR}].
 *
 * <pre>
 *   bracket fungi          ≤1 / ≤3 / ≤5 / &gt;5 fruiting bodies → 0.85 / 0.75 / 0.65 / 0.55
 *   cavity with decay      0.80
 *   cracks / shear planes  0.85
 *   basal decay            0.75
 *   included bark          0.85
 *
 *   only with active decay (fungi, cavity decay or basal decay):
 *     decay type × location × severity
 *     (unrecorded: unknown type, stem base, moderate)
 *
 *   always:
 *     extent e %           clamp(1 − e/100 × 0.4, 0.4, 1.0)
 *     resonance            drum 0.90 / hollow 0.75
 *     column height h_c    clamp(1 − clamp(h_c/H, 0, 1) × 0.3, 0.5, 1.0)
 * </pre>
 *
 * <p>Pure static utility.
 */
public final class DefectStrengthComposer {

    public static final double MIN_FACTOR = 0.20;
    public static final double MAX_FACTOR = 1.00;

    /** Tree height assumed for the column ratio when none is supplied. */
    static final double FALLBACK_TREE_HEIGHT_M = 15.0;

    private DefectStrengthComposer() {}

    /**
     * @param observations field observations, {@code null} for none
     * @param treeHeightM  tree height used to scale the decay column, may be {@code null}
     * @return factor in [0.20, 1.00]
     */
    public static double compose(DefectObservations observations, Double treeHeightM) {
        if (observations == null) return MAX_FACTOR;

        double k = 1.0;

        if (observations.bracketFungi()) {
            k *= bracketFungiFactor(observations.fruitingBodyCount());
        }
        if (observations.cavityDecay())  k *= 0.80;
        if (observations.cracks())       k *= 0.85;
        if (observations.basalDecay())   k *= 0.75;
        if (observations.includedBark()) k *= 0.85;

        if (observations.activeDecay()) {
            DecayType type = observations.decayType() != null
                ? observations.decayType()
                : DecayType.UNKNOWN;
            DecayLocation location = observations.decayLocation() != null
                ? observations.decayLocation()
                : DecayLocation.STEM_BASE;
            DecaySeverity severity = observations.decaySeverity() != null
                ? observations.decaySeverity()
                : DecaySeverity.MODERATE;
            k *= type.strengthFactor() * location.strengthFactor() * severity.strengthFactor();
        }

        k *= extentFactor(observations.decayExtentPercent());

        if (observations.resonance() != null) {
            k *= observations.resonance().strengthFactor();
        }

        k *= columnHeightFactor(observations.decayColumnHeight(), treeHeightM);

        return clamp(k, MIN_FACTOR, MAX_FACTOR);
    }

    static double bracketFungiFactor(int fruitingBodies) {
        if (fruitingBodies <= 1) return 0.85;
        if (fruitingBodies <= 3) return 0.75;
        if (fruitingBodies <= 5) return 0.65;
        return 0.55;
    }

    static double extentFactor(double extentPercent) {
        if (!(extentPercent > 0.0)) return 1.0;
        return clamp(1.0 - (extentPercent / 100.0) * 0.4, 0.4, 1.0);
    }

    static double columnHeightFactor(Double columnHeightM, Double treeHeightM) {
        if (columnHeightM == null || !(columnHeightM > 0.0)) return 1.0;
        double height = treeHeightM != null && treeHeightM > 0.0 ? treeHeightM : FALLBACK_TREE_HEIGHT_M;
        double ratio = clamp(columnHeightM / height, 0.0, 1.0);
        return clamp(1.0 - ratio * 0.3, 0.5, 1.0);
    }

    private static double clamp(double value, double min, double max) {
        return Math.max(min, Math.min(max, value));
    }
}
