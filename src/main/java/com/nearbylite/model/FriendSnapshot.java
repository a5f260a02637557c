package com.nearbylite.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * One roster entry as delivered by the friends source.
 * {@code coordinate} is null when the friend has not reported a location yet.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record FriendSnapshot(
    @JsonProperty("id") String id,
    @JsonProperty("display_name") String displayName,
    @JsonProperty("avatar_url") String avatarUrl,
    @JsonProperty("coordinate") Coordinate coordinate,
    @JsonProperty("online") boolean isOnline,
    @JsonProperty("last_active_ms") long lastActiveAtMillis
) {
    public FriendSnapshot {
        Objects.requireNonNull(id, "id");
        displayName = displayName == null ? "" : displayName;
        avatarUrl = avatarUrl == null || avatarUrl.isBlank() ? null : avatarUrl;
    }

    public static FriendSnapshot of(String id, String displayName, Coordinate coordinate,
                                    boolean isOnline, long lastActiveAtMillis) {
        return new FriendSnapshot(id, displayName, null, coordinate, isOnline, lastActiveAtMillis);
    }

    public boolean hasCoordinate() {
        return coordinate != null;
    }
}
