package com.arborstatics.common.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Ordered (x, y) sequence produced by a sweep. Points are in ascending x.
 */
public record Curve(
    @JsonProperty("points") List<CurvePoint> points
) {

    public Curve {
        points = points == null ? List.of() : List.copyOf(points);
    }

    public static Curve empty() {
        return new Curve(List.of());
    }

    @JsonIgnore
    public int size() {
        return points.size();
    }

    @JsonIgnore
    public boolean isEmpty() {
        return points.isEmpty();
    }
}
