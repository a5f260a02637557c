package com.nearbylite.config;

/**
 * Tunables of the proximity engine. All distances in metres, all durations in milliseconds.
 */
public record ProximityConfig(
    double geoFilterRadiusMeters,
    double movementThresholdMeters,
    long   timeThresholdMs,
    double distanceToleranceMeters,
    double scoreTolerance,
    int    maxTrackedFriends,
    float  proximityWeight,
    float  recencyWeight,
    float  statusWeight,
    long   recencyWindowMs,
    int    parallelThreshold,
    long   pollTimeoutMs
) {

    public static final double GEO_FILTER_RADIUS_METERS       = 10_000.0;
    public static final double MOVEMENT_THRESHOLD_METERS      = 20.0;
    public static final long   TIME_THRESHOLD_MS              = 10_000L;
    public static final double DISTANCE_TOLERANCE_METERS      = 1.0;
    public static final double SCORE_TOLERANCE                = 0.01;
    public static final int    MAX_TRACKED_FRIENDS            = 1_000;
    public static final float  PROXIMITY_WEIGHT               = 0.5f;
    public static final float  RECENCY_WEIGHT                 = 0.3f;
    public static final float  STATUS_WEIGHT                  = 0.2f;
    public static final long   RECENCY_NORMALIZATION_WINDOW_MS = 24L * 60 * 60 * 1000;
    public static final int    PARALLEL_THRESHOLD             = 100;
    public static final long   POLL_TIMEOUT_MS                = 100L;

    private static final double WEIGHT_SUM_EPSILON = 1e-6;

    public ProximityConfig {
        requireNonNegative("geo-filter-radius-meters", geoFilterRadiusMeters);
        requireNonNegative("movement-threshold-meters", movementThresholdMeters);
        requireNonNegative("time-threshold-ms", timeThresholdMs);
        requireNonNegative("distance-tolerance-meters", distanceToleranceMeters);
        requireNonNegative("score-tolerance", scoreTolerance);
        requireNonNegative("proximity-weight", proximityWeight);
        requireNonNegative("recency-weight", recencyWeight);
        requireNonNegative("status-weight", statusWeight);
        if (maxTrackedFriends <= 0) {
            throw new IllegalArgumentException("max-tracked-friends must be > 0, got " + maxTrackedFriends);
        }
        if (recencyWindowMs <= 0) {
            throw new IllegalArgumentException("recency-window-ms must be > 0, got " + recencyWindowMs);
        }
        if (parallelThreshold <= 0) {
            throw new IllegalArgumentException("parallel-threshold must be > 0, got " + parallelThreshold);
        }
        if (pollTimeoutMs <= 0) {
            throw new IllegalArgumentException("poll-timeout-ms must be > 0, got " + pollTimeoutMs);
        }
        double sum = (double) proximityWeight + recencyWeight + statusWeight;
        if (Math.abs(sum - 1.0) > WEIGHT_SUM_EPSILON) {
            throw new IllegalArgumentException("ranking weights must sum to 1.0, got " + sum);
        }
    }

    public static ProximityConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
            .geoFilterRadiusMeters(geoFilterRadiusMeters)
            .movementThresholdMeters(movementThresholdMeters)
            .timeThresholdMs(timeThresholdMs)
            .distanceToleranceMeters(distanceToleranceMeters)
            .scoreTolerance(scoreTolerance)
            .maxTrackedFriends(maxTrackedFriends)
            .weights(proximityWeight, recencyWeight, statusWeight)
            .recencyWindowMs(recencyWindowMs)
            .parallelThreshold(parallelThreshold)
            .pollTimeoutMs(pollTimeoutMs);
    }

    private static void requireNonNegative(String key, double value) {
        if (!(value >= 0)) {
            throw new IllegalArgumentException(key + " must be a non-negative number, got " + value);
        }
    }

    public static final class Builder {
        private double geoFilterRadiusMeters   = GEO_FILTER_RADIUS_METERS;
        private double movementThresholdMeters = MOVEMENT_THRESHOLD_METERS;
        private long   timeThresholdMs         = TIME_THRESHOLD_MS;
        private double distanceToleranceMeters = DISTANCE_TOLERANCE_METERS;
        private double scoreTolerance          = SCORE_TOLERANCE;
        private int    maxTrackedFriends       = MAX_TRACKED_FRIENDS;
        private float  proximityWeight         = PROXIMITY_WEIGHT;
        private float  recencyWeight           = RECENCY_WEIGHT;
        private float  statusWeight            = STATUS_WEIGHT;
        private long   recencyWindowMs         = RECENCY_NORMALIZATION_WINDOW_MS;
        private int    parallelThreshold       = PARALLEL_THRESHOLD;
        private long   pollTimeoutMs           = POLL_TIMEOUT_MS;

        private Builder() {}

        public Builder geoFilterRadiusMeters(double v)   { this.geoFilterRadiusMeters = v; return this; }
        public Builder movementThresholdMeters(double v) { this.movementThresholdMeters = v; return this; }
        public Builder timeThresholdMs(long v)           { this.timeThresholdMs = v; return this; }
        public Builder distanceToleranceMeters(double v) { this.distanceToleranceMeters = v; return this; }
        public Builder scoreTolerance(double v)          { this.scoreTolerance = v; return this; }
        public Builder maxTrackedFriends(int v)          { this.maxTrackedFriends = v; return this; }
        public Builder recencyWindowMs(long v)           { this.recencyWindowMs = v; return this; }
        public Builder parallelThreshold(int v)          { this.parallelThreshold = v; return this; }
        public Builder pollTimeoutMs(long v)             { this.pollTimeoutMs = v; return this; }

        public Builder weights(float proximity, float recency, float status) {
            this.proximityWeight = proximity;
            this.recencyWeight = recency;
            this.statusWeight = status;
            return this;
        }

        public ProximityConfig build() {
            return new ProximityConfig(
                geoFilterRadiusMeters, movementThresholdMeters, timeThresholdMs,
                distanceToleranceMeters, scoreTolerance, maxTrackedFriends,
                proximityWeight, recencyWeight, statusWeight,
                recencyWindowMs, parallelThreshold, pollTimeoutMs);
        }
    }
}
