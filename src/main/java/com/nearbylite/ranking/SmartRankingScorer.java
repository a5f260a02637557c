package com.nearbylite.ranking;

import com.nearbylite.config.ProximityConfig;

/**
 * Blends proximity, recency and online status into one ascending-priority score in [0, 1].
 * <pre>
 *   score = w_p * min(distance / radius, 1)
 *         + w_r * min((now - lastActive) / recencyWindow, 1)
 *         + w_s * (online ? 0 : 1)
 * </pre>
 * A recently-active online friend a bit further away can outrank a closer stale offline one.
 */
public final class SmartRankingScorer {

    private final double radiusMeters;
    private final long recencyWindowMs;
    private final float proximityWeight;
    private final float recencyWeight;
    private final float statusWeight;

    public SmartRankingScorer(ProximityConfig config) {
        this.radiusMeters = config.geoFilterRadiusMeters();
        this.recencyWindowMs = config.recencyWindowMs();
        this.proximityWeight = config.proximityWeight();
        this.recencyWeight = config.recencyWeight();
        this.statusWeight = config.statusWeight();
    }

    public float score(double distanceMeters, long lastActiveAtMillis, boolean isOnline, long nowMillis) {
        float proximity = proximitySubScore(distanceMeters);
        float recency = recencySubScore(lastActiveAtMillis, nowMillis);
        float status = isOnline ? 0f : 1f;
        return proximity * proximityWeight + recency * recencyWeight + status * statusWeight;
    }

    float proximitySubScore(double distanceMeters) {
        if (radiusMeters == 0) return distanceMeters > 0 ? 1f : 0f;
        return (float) Math.min(distanceMeters / radiusMeters, 1.0);
    }

    // Clock skew can put lastActive in the future; that counts as "just now".
    float recencySubScore(long lastActiveAtMillis, long nowMillis) {
        long elapsed = Math.max(0L, nowMillis - lastActiveAtMillis);
        return (float) Math.min((double) elapsed / recencyWindowMs, 1.0);
    }
}
