package com.arborstatics.analysis.dto;

import com.arborstatics.common.model.DefectObservations;
import com.arborstatics.common.model.RootPlateObservations;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Raw assessment inputs as entered in the field.
 *
 * <p>Units: {@code dbh} and {@code cavityInnerDiameter} in cm, {@code height}
 * and {@code crownDiameter} in m, {@code designWindSpeed} in m/s. An explicit
 * {@code designWindSpeed} wins over {@code windProfileId}. {@code defects}
 * and {@code rootPlate} are optional.
 */
public record AssessmentRequest(
    @JsonProperty("speciesId")           String speciesId,
    @JsonProperty("dbh")                 Double dbh,
    @JsonProperty("height")              Double height,
    @JsonProperty("crownDiameter")       Double crownDiameter,
    @JsonProperty("cavityInnerDiameter") Double cavityInnerDiameter,
    @JsonProperty("windProfileId")       String windProfileId,
    @JsonProperty("designWindSpeed")     Double designWindSpeed,
    @JsonProperty("siteFactor")          Double siteFactor,
    @JsonProperty("fullnessOverride")    Double fullnessOverride,
    @JsonProperty("defects")             DefectObservations defects,
    @JsonProperty("rootPlate")           RootPlateObservations rootPlate
) {

    public double siteFactorOrDefault() {
        return siteFactor != null ? siteFactor : 1.0;
    }
}
