package com.nearbylite.config;

import java.util.Objects;

/**
 * Everything {@link com.nearbylite.NearbyFriendsApplication} needs to boot.
 */
public record AppConfig(
    ProximityConfig proximity,
    String bootstrapServers,
    String applicationId,
    long metricsLogIntervalMs
) {
    public AppConfig {
        Objects.requireNonNull(proximity, "proximity");
        Objects.requireNonNull(bootstrapServers, "bootstrapServers");
        Objects.requireNonNull(applicationId, "applicationId");
    }
}
