package com.nearbylite.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.Locale;
import java.util.Map;
import java.util.Properties;

/**
 * Resolves configuration from, in increasing precedence:
 * <ol>
 *   <li>{@value #RESOURCE} on the classpath</li>
 *   <li>JVM system properties with the same key</li>
 *   <li>environment variables, key upper-cased with '.' and '-' turned into '_'
 *       (e.g. {@code nearby.max-tracked-friends} -> {@code NEARBY_MAX_TRACKED_FRIENDS})</li>
 * </ol>
 * {@code KAFKA_BOOTSTRAP_SERVERS} is honoured as well.
 */
public final class ConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);

    public static final String RESOURCE = "nearby-friends.properties";

    public static final String GEO_FILTER_RADIUS   = "nearby.geo-filter-radius-meters";
    public static final String MOVEMENT_THRESHOLD  = "nearby.movement-threshold-meters";
    public static final String TIME_THRESHOLD      = "nearby.time-threshold-ms";
    public static final String DISTANCE_TOLERANCE  = "nearby.distance-tolerance-meters";
    public static final String SCORE_TOLERANCE     = "nearby.score-tolerance";
    public static final String MAX_TRACKED_FRIENDS = "nearby.max-tracked-friends";
    public static final String PROXIMITY_WEIGHT    = "nearby.weight.proximity";
    public static final String RECENCY_WEIGHT      = "nearby.weight.recency";
    public static final String STATUS_WEIGHT       = "nearby.weight.status";
    public static final String RECENCY_WINDOW      = "nearby.recency-window-ms";
    public static final String PARALLEL_THRESHOLD  = "nearby.parallel-threshold";
    public static final String POLL_TIMEOUT        = "nearby.poll-timeout-ms";

    public static final String BOOTSTRAP_SERVERS   = "kafka.bootstrap-servers";
    public static final String APPLICATION_ID      = "kafka.application-id";
    public static final String METRICS_INTERVAL    = "metrics.log-interval-ms";

    public static AppConfig load() {
        return load(readClasspath(), System.getProperties(), System.getenv());
    }

    public static AppConfig load(Properties file, Properties system, Map<String, String> env) {
        var r = new Resolver(file, system, env);

        var proximity = ProximityConfig.builder()
            .geoFilterRadiusMeters(r.getDouble(GEO_FILTER_RADIUS, ProximityConfig.GEO_FILTER_RADIUS_METERS))
            .movementThresholdMeters(r.getDouble(MOVEMENT_THRESHOLD, ProximityConfig.MOVEMENT_THRESHOLD_METERS))
            .timeThresholdMs(r.getLong(TIME_THRESHOLD, ProximityConfig.TIME_THRESHOLD_MS))
            .distanceToleranceMeters(r.getDouble(DISTANCE_TOLERANCE, ProximityConfig.DISTANCE_TOLERANCE_METERS))
            .scoreTolerance(r.getDouble(SCORE_TOLERANCE, ProximityConfig.SCORE_TOLERANCE))
            .maxTrackedFriends((int) r.getLong(MAX_TRACKED_FRIENDS, ProximityConfig.MAX_TRACKED_FRIENDS))
            .weights(
                (float) r.getDouble(PROXIMITY_WEIGHT, ProximityConfig.PROXIMITY_WEIGHT),
                (float) r.getDouble(RECENCY_WEIGHT, ProximityConfig.RECENCY_WEIGHT),
                (float) r.getDouble(STATUS_WEIGHT, ProximityConfig.STATUS_WEIGHT))
            .recencyWindowMs(r.getLong(RECENCY_WINDOW, ProximityConfig.RECENCY_NORMALIZATION_WINDOW_MS))
            .parallelThreshold((int) r.getLong(PARALLEL_THRESHOLD, ProximityConfig.PARALLEL_THRESHOLD))
            .pollTimeoutMs(r.getLong(POLL_TIMEOUT, ProximityConfig.POLL_TIMEOUT_MS))
            .build();

        String bootstrap = env.getOrDefault("KAFKA_BOOTSTRAP_SERVERS",
            r.getString(BOOTSTRAP_SERVERS, "localhost:9092"));

        var config = new AppConfig(
            proximity,
            bootstrap,
            r.getString(APPLICATION_ID, "nearby-friends-app"),
            r.getLong(METRICS_INTERVAL, 10_000L));
        log.info("Resolved configuration: {}", config);
        return config;
    }

    static String envKey(String key) {
        return key.toUpperCase(Locale.ROOT).replace('.', '_').replace('-', '_');
    }

    private static Properties readClasspath() {
        var props = new Properties();
        try (InputStream in = ConfigLoader.class.getClassLoader().getResourceAsStream(RESOURCE)) {
            if (in == null) {
                log.warn("{} not found on classpath, using built-in defaults", RESOURCE);
                return props;
            }
            props.load(in);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + RESOURCE, e);
        }
        return props;
    }

    private record Resolver(Properties file, Properties system, Map<String, String> env) {

        String getString(String key, String defaultValue) {
            String value = env.get(envKey(key));
            if (value == null) value = system.getProperty(key);
            if (value == null) value = file.getProperty(key);
            return value == null ? defaultValue : value.trim();
        }

        double getDouble(String key, double defaultValue) {
            String raw = getString(key, null);
            if (raw == null) return defaultValue;
            try {
                return Double.parseDouble(raw);
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Invalid number for " + key + ": '" + raw + "'", e);
            }
        }

        long getLong(String key, long defaultValue) {
            String raw = getString(key, null);
            if (raw == null) return defaultValue;
            try {
                return Long.parseLong(raw);
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Invalid integer for " + key + ": '" + raw + "'", e);
            }
        }
    }

    private ConfigLoader() {}
}
