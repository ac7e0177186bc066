package com.arborstatics.common.model;

/**
 * Decay organism class. Applied only when active decay is observed.
 */
public enum DecayType {
    /** Lignin-degrading; significant strength loss. */
    WHITE_ROT(0.85),
    /** Cellulose-degrading; brittle failure risk. */
    BROWN_ROT(0.80),
    /** Mainly a surface effect. */
    SOFT_ROT(0.90),
    UNKNOWN(0.90);

    private final double strengthFactor;

    DecayType(double strengthFactor) {
        this.strengthFactor = strengthFactor;
    }

    public double strengthFactor() {
        return strengthFactor;
    }
}
