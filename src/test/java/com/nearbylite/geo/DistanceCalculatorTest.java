package com.nearbylite.geo;

import com.nearbylite.model.Coordinate;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class DistanceCalculatorTest {

    @Test
    void thousandthOfDegreeLatitude_isAbout111Meters() {
        double d = DistanceCalculator.distance(Coordinate.of(0, 0), Coordinate.of(0.001, 0));
        assertEquals(111.0, d, 1.0);
    }

    @Test
    void samePoint_isZero() {
        var sf = Coordinate.of(37.7749, -122.4194);
        assertEquals(0.0, DistanceCalculator.distance(sf, sf), 1e-9);
    }

    @Test
    void distance_isSymmetric() {
        var a = Coordinate.of(37.7749, -122.4194);
        var b = Coordinate.of(37.8044, -122.2712);
        assertEquals(DistanceCalculator.distance(a, b), DistanceCalculator.distance(b, a));
    }

    @Test
    void knownCityPair_withinHalfPercent() {
        // San Francisco -> Oakland, ~13.4 km
        var sf = Coordinate.of(37.7749, -122.4194);
        var oakland = Coordinate.of(37.8044, -122.2712);
        double d = DistanceCalculator.distance(sf, oakland);
        assertEquals(13_430.0, d, 13_430.0 * 0.005);
    }

    @Test
    void antipodalPoints_areHalfCircumference() {
        double d = DistanceCalculator.distance(Coordinate.of(0, 0), Coordinate.of(0, 180));
        assertEquals(Math.PI * DistanceCalculator.EARTH_RADIUS_METERS, d, 1e-3);
        assertTrue(Double.isFinite(d));
    }

    @Test
    void nonFiniteInput_propagatesNaN() {
        assertTrue(Double.isNaN(DistanceCalculator.distance(Coordinate.of(Double.NaN, 0), Coordinate.of(0, 0))));
        assertTrue(Double.isNaN(DistanceCalculator.distance(0, 0, Double.POSITIVE_INFINITY, 0)));
    }
}
