package com.nearbylite.geo;

import com.nearbylite.model.Coordinate;
import com.nearbylite.model.FriendSnapshot;

import java.util.ArrayList;
import java.util.List;

/**
 * Keeps candidates whose great-circle distance to a centre is at most {@code radiusMeters}.
 */
public final class GeoFilter {

    public static final double DEFAULT_RADIUS_METERS = 10_000.0;

    private final double radiusMeters;

    public GeoFilter(double radiusMeters) {
        if (!(radiusMeters >= 0)) {
            throw new IllegalArgumentException("radiusMeters must be >= 0, got " + radiusMeters);
        }
        this.radiusMeters = radiusMeters;
    }

    public double radiusMeters() {
        return radiusMeters;
    }

    /** NaN distances are rejected. */
    public boolean accepts(double distanceMeters) {
        return distanceMeters <= radiusMeters;
    }

    public List<FriendSnapshot> filter(List<FriendSnapshot> candidates, Coordinate center) {
        return filter(candidates, center, radiusMeters);
    }

    public static List<FriendSnapshot> filter(List<FriendSnapshot> candidates, Coordinate center, double radiusMeters) {
        var kept = new ArrayList<FriendSnapshot>(candidates.size());
        for (var candidate : candidates) {
            if (!candidate.hasCoordinate()) continue;
            if (DistanceCalculator.distance(center, candidate.coordinate()) <= radiusMeters) {
                kept.add(candidate);
            }
        }
        return kept;
    }
}
