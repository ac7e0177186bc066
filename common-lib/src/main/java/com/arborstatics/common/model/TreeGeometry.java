package com.arborstatics.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Measured stem and crown geometry of a single tree.
 *
 * <p>Units: diameters in cm, height and crown diameter in m.
 * {@code cavityInnerDiameter} is {@code null} for a solid stem.
 */
public record TreeGeometry(
    @JsonProperty("diameterAtBreastHeight") double diameterAtBreastHeight,
    @JsonProperty("height")                 double height,
    @JsonProperty("crownDiameter")          double crownDiameter,
    @JsonProperty("cavityInnerDiameter")    Double cavityInnerDiameter
) {

    public TreeGeometry {
        if (!(diameterAtBreastHeight > 0.0) || Double.isInfinite(diameterAtBreastHeight)) {
            throw new IllegalArgumentException(
                "diameterAtBreastHeight must be finite and > 0, got " + diameterAtBreastHeight);
        }
    }

    public static TreeGeometry solid(double dbhCm, double heightM, double crownDiameterM) {
        return new TreeGeometry(dbhCm, heightM, crownDiameterM, null);
    }

    public TreeGeometry withCavity(Double cavityCm) {
        return new TreeGeometry(diameterAtBreastHeight, height, crownDiameter, cavityCm);
    }

    public TreeGeometry withCrownDiameter(double crownDiameterM) {
        return new TreeGeometry(diameterAtBreastHeight, height, crownDiameterM, cavityInnerDiameter);
    }
}
