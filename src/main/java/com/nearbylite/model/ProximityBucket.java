package com.nearbylite.model;

public enum ProximityBucket {
    VERY_CLOSE,
    NEARBY,
    IN_TOWN,
    UNKNOWN;

    public static final double VERY_CLOSE_LIMIT_METERS = 300.0;
    public static final double NEARBY_LIMIT_METERS = 2_000.0;

    public static ProximityBucket forDistance(double distanceMeters) {
        if (Double.isNaN(distanceMeters)) return UNKNOWN;
        if (distanceMeters < VERY_CLOSE_LIMIT_METERS) return VERY_CLOSE;
        if (distanceMeters < NEARBY_LIMIT_METERS) return NEARBY;
        return IN_TOWN;
    }
}
