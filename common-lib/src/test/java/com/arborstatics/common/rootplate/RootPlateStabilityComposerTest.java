package com.arborstatics.common.rootplate;

import com.arborstatics.common.model.RootPlateAssessment;
import com.arborstatics.common.model.RootPlateObservations;
import com.arborstatics.common.model.RootPlateRisk;
import com.arborstatics.common.model.RootZoneRestriction;
import com.arborstatics.common.model.SoilMoisture;
import com.arborstatics.common.model.SoilType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class RootPlateStabilityComposerTest {

    private static final double EPS = 1e-12;

    private static RootPlateObservations soil(SoilType type, SoilMoisture moisture) {
        return new RootPlateObservations(type, moisture, 0.0, false, false, 0.0, false,
            RootZoneRestriction.NONE, null, null);
    }

    private static RootPlateObservations lean(double degrees) {
        return new RootPlateObservations(SoilType.CLAY_LOAM, SoilMoisture.MOIST, degrees, false, false, 0.0,
            false, RootZoneRestriction.NONE, null, null);
    }

    @Nested
    @DisplayName("stabilityFactor()")
    class FactorTests {

        @Test
        @DisplayName("baseline observations → 1.0, LOW risk")
        void baseline() {
            RootPlateAssessment assessment = RootPlateStabilityComposer.compose(RootPlateObservations.baseline(), 50.0);
            assertEquals(1.0, assessment.stabilityFactor(), EPS);
            assertEquals(RootPlateRisk.LOW, assessment.risk());
        }

        @Test
        @DisplayName("null observations → 1.0")
        void nullObservations() {
            assertEquals(1.0, RootPlateStabilityComposer.stabilityFactor(null, 50.0));
        }

        @Test
        @DisplayName("rocky, dry soil exceeds 1.0 but is capped at 1.1")
        void rockyDry_cappedAbove() {
            double factor = RootPlateStabilityComposer.stabilityFactor(soil(SoilType.ROCKY, SoilMoisture.DRY), 50.0);
            assertEquals(1.1, factor, EPS);
        }

        @Test
        @DisplayName("waterlogged organic soil compounds both factors")
        void waterloggedOrganic() {
            double factor = RootPlateStabilityComposer.stabilityFactor(
                soil(SoilType.ORGANIC, SoilMoisture.WATERLOGGED), 50.0);
            assertEquals(0.75 * 0.65, factor, EPS);
        }

        @Test
        @DisplayName("lean bands: 5 / 10 / 15 / beyond")
        void leanBands() {
            assertEquals(1.0, RootPlateStabilityComposer.leanFactor(0.0));
            assertEquals(0.95, RootPlateStabilityComposer.leanFactor(5.0));
            assertEquals(0.85, RootPlateStabilityComposer.leanFactor(8.0));
            assertEquals(0.70, RootPlateStabilityComposer.leanFactor(15.0));
            assertEquals(0.50, RootPlateStabilityComposer.leanFactor(25.0));
        }

        @Test
        @DisplayName("severed roots reduce linearly to a 0.3 floor")
        void severedRoots() {
            RootPlateObservations half = new RootPlateObservations(SoilType.CLAY_LOAM, SoilMoisture.MOIST,
                0.0, false, false, 50.0, false, RootZoneRestriction.NONE, null, null);
            RootPlateObservations all = new RootPlateObservations(SoilType.CLAY_LOAM, SoilMoisture.MOIST,
                0.0, false, false, 100.0, false, RootZoneRestriction.NONE, null, null);
            assertEquals(0.6, RootPlateStabilityComposer.stabilityFactor(half, 50.0), EPS);
            assertEquals(0.3, RootPlateStabilityComposer.stabilityFactor(all, 50.0), EPS);
        }

        @Test
        @DisplayName("plate radius judged against 3.5 × DBH")
        void radiusFactor() {
            // 50 cm DBH → 1.75 m expected
            assertEquals(0.75, RootPlateStabilityComposer.radiusFactor(1.0, 50.0));
            assertEquals(0.90, RootPlateStabilityComposer.radiusFactor(1.5, 50.0));
            assertEquals(1.0, RootPlateStabilityComposer.radiusFactor(2.0, 50.0));
            assertEquals(1.0, RootPlateStabilityComposer.radiusFactor(1.0, null));
            assertEquals(1.0, RootPlateStabilityComposer.radiusFactor(null, 50.0));
        }

        @Test
        @DisplayName("shallow plates are penalised")
        void depthFactor() {
            assertEquals(0.70, RootPlateStabilityComposer.depthFactor(0.2));
            assertEquals(0.85, RootPlateStabilityComposer.depthFactor(0.4));
            assertEquals(1.0, RootPlateStabilityComposer.depthFactor(0.8));
            assertEquals(1.0, RootPlateStabilityComposer.depthFactor(null));
        }

        @Test
        @DisplayName("worst case clamps to the 0.2 floor, CRITICAL risk")
        void worstCase_floor() {
            RootPlateObservations worst = new RootPlateObservations(SoilType.ORGANIC, SoilMoisture.WATERLOGGED,
                30.0, true, true, 90.0, true, RootZoneRestriction.EXCAVATION, 0.5, 0.1);
            RootPlateAssessment assessment = RootPlateStabilityComposer.compose(worst, 80.0);
            assertEquals(0.2, assessment.stabilityFactor(), EPS);
            assertEquals(RootPlateRisk.CRITICAL, assessment.risk());
        }
    }

    @Nested
    @DisplayName("risk bands")
    class RiskTests {

        @Test
        @DisplayName("lean of 8° alone → MODERATE")
        void moderateLean() {
            assertEquals(RootPlateRisk.MODERATE,
                RootPlateStabilityComposer.compose(lean(8.0), 50.0).risk());
        }

        @Test
        @DisplayName("band edges")
        void bandEdges() {
            assertEquals(RootPlateRisk.LOW, RootPlateRisk.of(0.9));
            assertEquals(RootPlateRisk.MODERATE, RootPlateRisk.of(0.89));
            assertEquals(RootPlateRisk.MODERATE, RootPlateRisk.of(0.7));
            assertEquals(RootPlateRisk.HIGH, RootPlateRisk.of(0.5));
            assertEquals(RootPlateRisk.CRITICAL, RootPlateRisk.of(0.49));
        }
    }
}
