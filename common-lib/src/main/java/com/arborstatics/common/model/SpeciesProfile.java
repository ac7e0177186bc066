package com.arborstatics.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Species-group preset used by the statics model.
 *
 * <ul>
 *   <li>{@code greenBendingStrength}: nominal green bending strength f_b (MPa)</li>
 *   <li>{@code dragCoefficient}: C_d, dimensionless</li>
 *   <li>{@code crownShapeFactor}: k_A, plan area to projected area</li>
 *   <li>{@code defaultFullness}: crown fullness in [0, 1]</li>
 * </ul>
 */
public record SpeciesProfile(
    @JsonProperty("id")                   String id,
    @JsonProperty("displayName")          String displayName,
    @JsonProperty("greenBendingStrength") double greenBendingStrength,
    @JsonProperty("dragCoefficient")      double dragCoefficient,
    @JsonProperty("crownShapeFactor")     double crownShapeFactor,
    @JsonProperty("defaultFullness")      double defaultFullness
) {}
