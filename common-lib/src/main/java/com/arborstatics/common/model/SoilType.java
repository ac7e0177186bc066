package com.arborstatics.common.model;

/**
 * Soil class around the root plate. Rock can exceed baseline anchorage.
 */
public enum SoilType {
    ROCKY(1.10),
    CLAY(0.95),
    CLAY_LOAM(1.00),
    LOAM(0.95),
    SANDY(0.85),
    ORGANIC(0.75);

    private final double anchorageFactor;

    SoilType(double anchorageFactor) {
        this.anchorageFactor = anchorageFactor;
    }

    public double anchorageFactor() {
        return anchorageFactor;
    }
}
