package com.arborstatics.common.model;

/** Outcome of a sounding (mallet) test on the stem. */
public enum ResonanceResult {
    NOT_TESTED(1.0),
    SOLID(1.0),
    DRUM(0.90),
    HOLLOW(0.75);

    private final double strengthFactor;

    ResonanceResult(double strengthFactor) {
        this.strengthFactor = strengthFactor;
    }

    public double strengthFactor() {
        return strengthFactor;
    }
}
