package com.nearbylite.engine;

import com.nearbylite.config.ProximityConfig;
import com.nearbylite.model.NearbyFriendResult;

import java.util.HashMap;
import java.util.List;

/**
 * Decides whether a freshly computed snapshot differs enough from the last emitted one to be
 * worth pushing downstream. A size change or a new id always emits; otherwise at least one
 * friend has to move by the distance tolerance or shift score by the score tolerance.
 */
public final class ChangeDetector {

    private final double distanceTolerance;
    private final double scoreTolerance;

    public ChangeDetector(ProximityConfig config) {
        this(config.distanceToleranceMeters(), config.scoreTolerance());
    }

    public ChangeDetector(double distanceTolerance, double scoreTolerance) {
        this.distanceTolerance = distanceTolerance;
        this.scoreTolerance = scoreTolerance;
    }

    public boolean shouldEmit(List<NearbyFriendResult> previous, List<NearbyFriendResult> candidate) {
        if (previous == null) return true;
        if (previous.size() != candidate.size()) return true;
        if (previous == candidate) return false;

        var byId = new HashMap<String, NearbyFriendResult>(previous.size() * 2);
        for (var p : previous) {
            byId.put(p.id(), p);
        }
        for (var c : candidate) {
            var p = byId.get(c.id());
            if (p == null) return true;
            if (differs(p.distanceMeters(), c.distanceMeters(), distanceTolerance)) return true;
            if (differs(p.rankScore(), c.rankScore(), scoreTolerance)) return true;
        }
        return false;
    }

    private static boolean differs(double a, double b, double tolerance) {
        boolean aNaN = Double.isNaN(a);
        boolean bNaN = Double.isNaN(b);
        if (aNaN || bNaN) return aNaN != bNaN;
        return Math.abs(a - b) >= tolerance;
    }
}
