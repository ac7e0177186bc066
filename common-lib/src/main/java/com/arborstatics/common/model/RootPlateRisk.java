package com.arborstatics.common.model;

/**
 * Advisory risk band for root-plate anchorage.
 */
public enum RootPlateRisk {
    LOW,
    MODERATE,
    HIGH,
    CRITICAL;

    public static RootPlateRisk of(double stabilityFactor) {
        if (stabilityFactor >= 0.9) return LOW;
        if (stabilityFactor >= 0.7) return MODERATE;
        if (stabilityFactor >= 0.5) return HIGH;
        return CRITICAL;
    }
}
