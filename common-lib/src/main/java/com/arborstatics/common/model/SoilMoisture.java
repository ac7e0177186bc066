package com.arborstatics.common.model;

public enum SoilMoisture {
    DRY(1.05),
    MOIST(1.00),
    WET(0.85),
    WATERLOGGED(0.65);

    private final double anchorageFactor;

    SoilMoisture(double anchorageFactor) {
        this.anchorageFactor = anchorageFactor;
    }

    public double anchorageFactor() {
        return anchorageFactor;
    }
}
