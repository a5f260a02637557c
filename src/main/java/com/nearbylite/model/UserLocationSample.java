package com.nearbylite.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

public record UserLocationSample(
    @JsonProperty("coordinate") Coordinate coordinate,
    @JsonProperty("captured_at_ms") long capturedAtMillis
) {
    public UserLocationSample {
        Objects.requireNonNull(coordinate, "coordinate");
    }

    public static UserLocationSample of(double lat, double lon, long capturedAtMillis) {
        return new UserLocationSample(new Coordinate(lat, lon), capturedAtMillis);
    }
}
