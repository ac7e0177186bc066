package com.arborstatics.common.model;

/**
 * What limits root development next to the tree. Recent excavation is the
 * most damaging.
 */
public enum RootZoneRestriction {
    NONE(1.00),
    PAVEMENT(0.85),
    BUILDING(0.75),
    WALL(0.80),
    EXCAVATION(0.65);

    private final double anchorageFactor;

    RootZoneRestriction(double anchorageFactor) {
        this.anchorageFactor = anchorageFactor;
    }

    public double anchorageFactor() {
        return anchorageFactor;
    }
}
