package com.nearbylite.geo;

import com.nearbylite.model.Coordinate;

/**
 * Great-circle distance on a spherical Earth (haversine).
 * Non-finite inputs yield NaN; callers filter those out.
 */
public final class DistanceCalculator {

    /** IUGG mean Earth radius. */
    public static final double EARTH_RADIUS_METERS = 6_371_000.0;

    public static double distance(Coordinate a, Coordinate b) {
        return distance(a.latitude(), a.longitude(), b.latitude(), b.longitude());
    }

    public static double distance(double lat1, double lon1, double lat2, double lon2) {
        double phi1 = Math.toRadians(lat1);
        double phi2 = Math.toRadians(lat2);
        double dPhi = Math.toRadians(lat2 - lat1);
        double dLambda = Math.toRadians(lon2 - lon1);

        double sinHalfPhi = Math.sin(dPhi / 2);
        double sinHalfLambda = Math.sin(dLambda / 2);
        double h = sinHalfPhi * sinHalfPhi
            + Math.cos(phi1) * Math.cos(phi2) * sinHalfLambda * sinHalfLambda;

        // clamp: rounding can push h a hair past 1 for antipodal points
        h = Math.min(1.0, h);
        return 2 * EARTH_RADIUS_METERS * Math.asin(Math.sqrt(h));
    }

    private DistanceCalculator() {}
}
