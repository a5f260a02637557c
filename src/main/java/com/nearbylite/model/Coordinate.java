package com.nearbylite.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Immutable WGS84 latitude/longitude pair in decimal degrees.
 */
public record Coordinate(
    @JsonProperty("lat") double latitude,
    @JsonProperty("lon") double longitude
) {

    public static Coordinate of(double latitude, double longitude) {
        return new Coordinate(latitude, longitude);
    }

    /** Finite and inside [-90, 90] x [-180, 180]. */
    @JsonIgnore
    public boolean isValid() {
        return Double.isFinite(latitude) && Double.isFinite(longitude)
            && latitude >= -90.0 && latitude <= 90.0
            && longitude >= -180.0 && longitude <= 180.0;
    }
}
