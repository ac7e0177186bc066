package com.arborstatics.common.model;

/**
 * Estimated share of the cross-section affected by decay.
 */
public enum DecaySeverity {
    /** Under 10 %. */
    MINOR(0.95),
    /** 10-30 %. */
    MODERATE(0.85),
    /** 30-50 %. */
    SEVERE(0.70),
    /** Over 50 %. */
    EXTENSIVE(0.50);

    private final double strengthFactor;

    DecaySeverity(double strengthFactor) {
        this.strengthFactor = strengthFactor;
    }

    public double strengthFactor() {
        return strengthFactor;
    }
}
