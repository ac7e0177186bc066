package com.arborstatics.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Root-zone observations used for the advisory anchorage score.
 *
 * <p>{@code rootPlateRadius} and {@code rootPlateDepth} are in metres and
 * {@code null} when not measured.
 */
public record RootPlateObservations(
    @JsonProperty("soilType")            SoilType soilType,
    @JsonProperty("soilMoisture")        SoilMoisture soilMoisture,
    @JsonProperty("leanAngleDegrees")    double leanAngleDegrees,
    @JsonProperty("recentLeanChange")    boolean recentLeanChange,
    @JsonProperty("heavingOrCracking")   boolean heavingOrCracking,
    @JsonProperty("severedRootsPercent") double severedRootsPercent,
    @JsonProperty("rootDecay")           boolean rootDecay,
    @JsonProperty("restriction")         RootZoneRestriction restriction,
    @JsonProperty("rootPlateRadius")     Double rootPlateRadius,
    @JsonProperty("rootPlateDepth")      Double rootPlateDepth
) {

    public static RootPlateObservations baseline() {
        return new RootPlateObservations(SoilType.CLAY_LOAM, SoilMoisture.MOIST,
            0.0, false, false, 0.0, false, RootZoneRestriction.NONE, null, null);
    }
}
