package com.arborstatics.common.model;

/**
 * Position of decay in the load path. Lower positions carry the whole tree.
 */
public enum DecayLocation {
    ROOT_PLATE(0.85),
    STEM_BASE(0.90),
    MID_STEM(0.95),
    UPPER_STEM(1.00);

    private final double strengthFactor;

    DecayLocation(double strengthFactor) {
        this.strengthFactor = strengthFactor;
    }

    public double strengthFactor() {
        return strengthFactor;
    }
}
