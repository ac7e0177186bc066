package com.arborstatics.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Wind region / exposure preset. {@code designWindSpeed} is the design gust
 * at tree height in m/s.
 */
public record WindProfile(
    @JsonProperty("id")              String id,
    @JsonProperty("displayName")     String displayName,
    @JsonProperty("designWindSpeed") double designWindSpeed
) {}
