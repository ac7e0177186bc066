package com.arborstatics.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Field observations of structural defects and decay for one tree.
 *
 * <p>Null enum fields and a null {@code decayColumnHeight} mean "not
 * assessed". When decay is active, an unrecorded {@code decayType},
 * {@code decayLocation} or {@code decaySeverity} is taken as
 * {@link DecayType#UNKNOWN}, {@link DecayLocation#STEM_BASE} and
 * {@link DecaySeverity#MODERATE}.
 */
public record DefectObservations(
    @JsonProperty("bracketFungi")         boolean bracketFungi,
    @JsonProperty("fruitingBodyCount")    int fruitingBodyCount,
    @JsonProperty("cavityDecay")          boolean cavityDecay,
    @JsonProperty("cracks")               boolean cracks,
    @JsonProperty("basalDecay")           boolean basalDecay,
    @JsonProperty("includedBark")         boolean includedBark,
    @JsonProperty("decayType")            DecayType decayType,
    @JsonProperty("decayLocation")        DecayLocation decayLocation,
    @JsonProperty("decaySeverity")        DecaySeverity decaySeverity,
    @JsonProperty("decayExtentPercent")   double decayExtentPercent,
    @JsonProperty("resonance")            ResonanceResult resonance,
    @JsonProperty("decayColumnHeight")    Double decayColumnHeight
) {

    public static DefectObservations none() {
        return new DefectObservations(false, 0, false, false, false, false,
            null, null, null, 0.0, null, null);
    }

    /** True when any of the observations indicating active decay is present. */
    public boolean activeDecay() {
        return bracketFungi || cavityDecay || basalDecay;
    }
}
