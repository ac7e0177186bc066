package com.arborstatics.common.model;

/**
 * AS 4970-aligned wording band for a safety factor. The bands are
 * interpretive only and carry no probability of failure.
 */
public enum SafetyMarginRating {

    /** SF ≥ 1.5, including the non-finite zero-stress state. */
    ADEQUATE("Adequate structural margin"),

    /** 1.0 ≤ SF &lt; 1.5. */
    REDUCED("Reduced structural margin"),

    /** SF &lt; 1.0. */
    UNACCEPTABLE("Unacceptable increase in failure likelihood");

    private static final double ADEQUATE_THRESHOLD = 1.5;
    private static final double REDUCED_THRESHOLD  = 1.0;

    private final String label;

    SafetyMarginRating(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    public static SafetyMarginRating of(double safetyFactor) {
        if (Double.isNaN(safetyFactor)) return UNACCEPTABLE;
        if (safetyFactor >= ADEQUATE_THRESHOLD) return ADEQUATE;
        if (safetyFactor >= REDUCED_THRESHOLD)  return REDUCED;
        return UNACCEPTABLE;
    }
}
