package com.nearbylite.engine;

import com.nearbylite.config.ProximityConfig;
import com.nearbylite.geo.DistanceCalculator;
import com.nearbylite.model.UserLocationSample;

/**
 * Gate run on every tick that has a user sample. Staleness of the served result is bounded
 * by {@code timeThresholdMs} or {@code movementThresholdMeters}, whichever comes first.
 * Checks run in order: first sample, roster change, elapsed time, displacement.
 */
public final class RecalculationPolicy {

    private final long timeThresholdMs;
    private final double movementThresholdMeters;

    public RecalculationPolicy(ProximityConfig config) {
        this.timeThresholdMs = config.timeThresholdMs();
        this.movementThresholdMeters = config.movementThresholdMeters();
    }

    public RecalculationReason evaluate(ResultCache cache, UserLocationSample sample,
                                        long rosterFingerprint, long nowMillis) {
        var previous = cache.userSample();
        if (previous == null) {
            return RecalculationReason.FIRST_SAMPLE;
        }
        if (rosterFingerprint != cache.rosterFingerprint()) {
            return RecalculationReason.ROSTER_CHANGED;
        }
        if (nowMillis - cache.recalculatedAtMillis() > timeThresholdMs) {
            return RecalculationReason.TIME_ELAPSED;
        }
        double moved = DistanceCalculator.distance(previous.coordinate(), sample.coordinate());
        // NaN (garbage sample) compares false and keeps the cache
        if (moved > movementThresholdMeters) {
            return RecalculationReason.MOVED;
        }
        return RecalculationReason.NONE;
    }
}
